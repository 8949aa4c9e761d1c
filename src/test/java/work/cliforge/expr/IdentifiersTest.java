package work.cliforge.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class IdentifiersTest {
    @Test
    void wordBoundariesNormalizeTheSameWay() {
        assertEquals("MyFlag", Identifiers.toCamelCase("my-flag"));
        assertEquals("MyFlag", Identifiers.toCamelCase("my_flag"));
        assertEquals("MyFlag", Identifiers.toCamelCase("my.flag"));
        assertEquals("KvGet", Identifiers.toCamelCase("kv get"));
    }

    @Test
    void keepsInnerCapitalsAndDigits() {
        assertEquals("ApiV2Token", Identifiers.toCamelCase("apiV2-token"));
        assertEquals("2fa", Identifiers.toCamelCase("2fa"));
    }

    @Test
    void derivesVariableNames() {
        assertEquals("flagVaultAddr", Identifiers.flagVariable("vault-addr"));
        assertEquals("stepReadSecretResult", Identifiers.stepVariable("read_secret"));
    }
}
