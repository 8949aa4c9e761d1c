package work.cliforge.runtime;

import java.util.List;

@FunctionalInterface
public interface RunHandler {
    void run(List<String> args, ExecutionContext context) throws Exception;
}
