package work.cliforge.runtime;

import work.cliforge.runtime.ExecutionContext.CancellationToken;

/**
 * Performs one HTTP exchange for a step. Implementations must abort the exchange when the token
 * is cancelled.
 */
public interface StepTransport {
    HttpStepResponse execute(HttpStepRequest request, CancellationToken token) throws Exception;
}
