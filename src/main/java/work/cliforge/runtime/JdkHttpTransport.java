package work.cliforge.runtime;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cliforge.runtime.ExecutionContext.CancellationToken;
import work.cliforge.runtime.ExecutionContext.ExecutionCancelledException;

/**
 * {@link StepTransport} over {@link HttpClient}. Redirects are followed; each request times out after 30 seconds.
 */
public final class JdkHttpTransport implements StepTransport {
    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpTransport.class);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(REQUEST_TIMEOUT)
            .build());
    }

    public JdkHttpTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public HttpStepResponse execute(HttpStepRequest request, CancellationToken token) throws IOException, InterruptedException {
        var builder = HttpRequest.newBuilder(URI.create(request.url())).timeout(REQUEST_TIMEOUT);
        request.headers().forEach(builder::header);
        var publisher = request.body()
            .map(HttpRequest.BodyPublishers::ofString)
            .orElseGet(HttpRequest.BodyPublishers::noBody);
        builder.method(request.method(), publisher);

        LOG.debug("{} {}", request.method(), request.url());
        var future = client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString());
        Runnable deregister = token.onCancel(() -> future.cancel(true));
        try {
            var response = future.get();
            LOG.debug("{} {} -> {}", request.method(), request.url(), response.statusCode());
            return new HttpStepResponse(response.statusCode(), response.body());
        } catch (CancellationException ex) {
            throw new ExecutionCancelledException("execution cancelled");
        } catch (InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            // the client completes a cancelled exchange with an IOException rather than a CancellationException
            if (token.isCancelled() || future.isCancelled()) {
                throw new ExecutionCancelledException("execution cancelled");
            }
            var cause = ex.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause == null ? ex.getMessage() : cause.getMessage(), cause == null ? ex : cause);
        } finally {
            deregister.run();
        }
    }
}
