package work.cliforge.runtime;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import work.cliforge.shared.CliforgeException;

/**
 * Per-invocation context handed to run handlers: where output goes and the cancellation scope
 * bounding the whole step chain.
 */
public final class ExecutionContext {
    private final PrintStream out;
    private final CancellationToken cancellationToken;

    public ExecutionContext(PrintStream out) {
        this(out, new CancellationToken());
    }

    public ExecutionContext(PrintStream out, CancellationToken token) {
        this.out = Objects.requireNonNull(out, "out");
        this.cancellationToken = token == null ? new CancellationToken() : token;
    }

    public PrintStream out() {
        return out;
    }

    public CancellationToken token() {
        return cancellationToken;
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new ExecutionCancelledException("execution cancelled");
        }
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    public static final class CancellationToken {
        private volatile boolean cancelled = false;
        private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

        public void cancel() {
            if (cancelled) {
                return;
            }
            this.cancelled = true;
            for (Runnable listener : listeners) {
                listener.run();
            }
        }

        public boolean isCancelled() {
            return cancelled;
        }

        /**
         * Registers a callback run on cancellation, immediately if already cancelled.
         * Returns a handle that removes the callback.
         */
        public Runnable onCancel(Runnable listener) {
            listeners.add(listener);
            if (cancelled) {
                listener.run();
            }
            return () -> listeners.remove(listener);
        }
    }

    public static final class ExecutionCancelledException extends CliforgeException {
        public ExecutionCancelledException(String message) {
            super("cancelled", message);
        }
    }
}
