package work.cliforge.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.cliforge.runtime.ExecutionContext.CancellationToken;
import work.cliforge.runtime.ExecutionContext.ExecutionCancelledException;
import work.cliforge.support.MockHttpServer;

class JdkHttpTransportTest {
    private final MockHttpServer server = new MockHttpServer();
    private final JdkHttpTransport transport = new JdkHttpTransport();

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void sendsMethodHeadersAndBody() throws Exception {
        server.respond("POST", "/v1/items", 201, "{\"id\":7}");
        var request = new HttpStepRequest(
            "POST",
            server.baseUrl() + "/v1/items",
            Map.of("X-Token", "abc"),
            Optional.of("{\"name\":\"x\"}")
        );

        var response = transport.execute(request, new CancellationToken());

        assertEquals(201, response.status());
        assertEquals("{\"id\":7}", response.body());
        assertTrue(response.successful());
        var recorded = server.requests().get(0);
        assertEquals("POST", recorded.method());
        assertEquals("abc", recorded.header("X-Token"));
        assertEquals("{\"name\":\"x\"}", recorded.body());
    }

    @Test
    void nonSuccessStatusIsReturnedNotThrown() throws Exception {
        var response = transport.execute(
            new HttpStepRequest("GET", server.baseUrl() + "/missing", Map.of(), Optional.empty()),
            new CancellationToken()
        );
        assertEquals(404, response.status());
        assertFalse(response.successful());
        assertEquals("not found", response.body());
    }

    @Test
    void cancellingTheTokenAbortsTheInFlightRequest() throws Exception {
        server.hang("/slow");
        var token = new CancellationToken();
        var request = new HttpStepRequest("GET", server.baseUrl() + "/slow", Map.of(), Optional.empty());
        var pool = Executors.newSingleThreadExecutor();
        try {
            Future<HttpStepResponse> pending = pool.submit(() -> transport.execute(request, token));
            assertTrue(server.awaitHang(5_000));
            token.cancel();
            var ex = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
            assertTrue(ex.getCause() instanceof ExecutionCancelledException, String.valueOf(ex.getCause()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void alreadyCancelledTokenFailsAsCancellation() {
        server.hang("/slow");
        var token = new CancellationToken();
        token.cancel();
        var request = new HttpStepRequest("GET", server.baseUrl() + "/slow", Map.of(), Optional.empty());

        var ex = assertThrows(ExecutionCancelledException.class, () -> transport.execute(request, token));
        assertEquals("cancelled", ex.code());
    }

    @Test
    void interruptingTheCallerStopsWaiting() throws Exception {
        server.hang("/slow");
        var request = new HttpStepRequest("GET", server.baseUrl() + "/slow", Map.of(), Optional.empty());
        var pool = Executors.newSingleThreadExecutor();
        try {
            Future<HttpStepResponse> pending = pool.submit(() -> transport.execute(request, new CancellationToken()));
            assertTrue(server.awaitHang(5_000));
            pool.shutdownNow();
            var ex = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
            assertTrue(ex.getCause() instanceof InterruptedException, String.valueOf(ex.getCause()));
        } finally {
            pool.shutdownNow();
        }
    }
}
