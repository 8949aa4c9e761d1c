package work.cliforge.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.cliforge.spec.ArgDefinition;

class ArityPolicyTest {
    @Test
    void allRequiredMeansExactCount() {
        var policy = ArityPolicy.of(List.of(new ArgDefinition("path", true)));
        assertTrue(policy.exact());
        assertEquals("accepts 1 arg(s), received 0", policy.check(0).orElseThrow());
        assertTrue(policy.check(1).isEmpty());
        assertEquals("accepts 1 arg(s), received 2", policy.check(2).orElseThrow());
    }

    @Test
    void anyOptionalMeansAtLeastTheRequiredCount() {
        var policy = ArityPolicy.of(List.of(new ArgDefinition("path", true), new ArgDefinition("version", false)));
        assertFalse(policy.exact());
        assertEquals("requires at least 1 arg(s), only received 0", policy.check(0).orElseThrow());
        assertTrue(policy.check(1).isEmpty());
        assertTrue(policy.check(2).isEmpty());
        // no upper bound even though two args are declared
        assertTrue(policy.check(3).isEmpty());
    }

    @Test
    void noArgsMeansNone() {
        var policy = ArityPolicy.of(List.of());
        assertTrue(policy.check(0).isEmpty());
        assertTrue(policy.check(1).isPresent());
    }
}
