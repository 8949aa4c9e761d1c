package work.cliforge.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cliforge.expr.ExpressionResolver;
import work.cliforge.expr.ReferenceException;
import work.cliforge.plan.ActionPlan;
import work.cliforge.plan.StepPlan;
import work.cliforge.render.OutputRenderer;
import work.cliforge.value.JsonCodec;
import work.cliforge.value.Value;
import work.cliforge.value.Values;

/**
 * Runs one leaf's action: steps strictly in order, each resolved against the results of the ones
 * before it, then the output. The first failing step ends the action with nothing rendered.
 */
public final class ActionExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ActionExecutor.class);

    private final ActionPlan plan;
    private final StepTransport transport;

    public ActionExecutor(ActionPlan plan, StepTransport transport) {
        this.plan = plan;
        this.transport = transport;
    }

    public ActionPlan plan() {
        return plan;
    }

    public void execute(Map<String, String> flags, List<String> args, ExecutionContext context) {
        var environment = new Environment(flags, plan.argNames(), args);
        var resolver = new ExpressionResolver<>(new ValueBackend(environment));

        for (StepPlan step : plan.steps()) {
            var result = runStep(step, resolver, context);
            environment.putStep(step.name(), result);
        }

        if (plan.output().isEmpty()) {
            return;
        }
        var output = plan.output().get();
        Value data;
        try {
            data = resolver.resolve(output.data());
        } catch (ReferenceException ex) {
            throw ex.withContext(plan.outputContext());
        }
        context.out().print(OutputRenderer.render(output, data));
        context.out().flush();
    }

    private Value runStep(StepPlan step, ExpressionResolver<Value> resolver, ExecutionContext context) {
        HttpStepResponse response;
        try {
            context.ensureNotCancelled();
            var request = buildRequest(step, resolver);
            LOG.info("{}: running step \"{}\"", plan.commandPath(), step.name());
            response = transport.execute(request, context.token());
        } catch (ReferenceException ex) {
            throw ex.withContext(plan.stepContext(step));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.name(), ex);
        } catch (Exception ex) {
            throw new StepExecutionException(step.name(), ex);
        }
        if (!response.successful()) {
            throw new StepExecutionException(step.name(), "HTTP " + response.status() + ": " + response.body());
        }
        var result = new LinkedHashMap<String, Value>();
        result.put("body", JsonCodec.parseLenient(response.body()));
        result.put("status", Value.of(response.status()));
        return new Value.MapValue(result);
    }

    private static HttpStepRequest buildRequest(StepPlan step, ExpressionResolver<Value> resolver) throws JsonProcessingException {
        var url = Values.stringify(resolver.resolve(step.url()));
        var headers = new LinkedHashMap<String, String>();
        if (step.headers().isPresent()) {
            var resolved = resolver.resolve(step.headers().get());
            if (resolved instanceof Value.MapValue map) {
                map.entries().forEach((key, value) -> headers.put(key, Values.stringify(value)));
            } else if (resolved != Value.NULL) {
                throw new IllegalArgumentException("headers must resolve to an object");
            }
        }
        Optional<String> body = Optional.empty();
        if (step.body().isPresent()) {
            body = encodeBody(resolver.resolve(step.body().get()));
        }
        return new HttpStepRequest(step.method(), url, headers, body);
    }

    /**
     * Strings are sent verbatim, null sends no body, anything else is JSON-encoded.
     */
    private static Optional<String> encodeBody(Value body) throws JsonProcessingException {
        if (body == Value.NULL) {
            return Optional.empty();
        }
        if (body instanceof Value.StringValue text) {
            return Optional.of(text.value());
        }
        return Optional.of(JsonCodec.compact(body));
    }
}
