package de.bsommerfeld.anchor.core.attempt;

import java.util.Optional;

/**
 * Outcome of a best-effort call whose failure is an expected, steady-state
 * result rather than a bug: a reflective constructor with unmet
 * preconditions, a host name lookup in a sandbox, a type that cannot be
 * linked.
 *
 * <p>
 * Exactly one of {@code value} and {@code failure} is meaningful. A
 * successful call may still carry a {@code null} value (void actions,
 * constructors of types whose instance is not kept).
 *
 * <h3>Fatal errors</h3>
 * Everything is absorbed except {@link VirtualMachineError}s other than
 * {@link StackOverflowError}: an exhausted heap or an internal VM error is
 * not a property of the touched API and is rethrown.
 */
public record Attempt<T>(T value, Throwable failure) {

    @FunctionalInterface
    public interface Action<T> {
        T get() throws Exception;
    }

    @FunctionalInterface
    public interface VoidAction {
        void run() throws Exception;
    }

    private static final Attempt<Void> DONE = new Attempt<>(null, null);

    public static <T> Attempt<T> of(Action<T> action) {
        try {
            return new Attempt<>(action.get(), null);
        } catch (Throwable t) {
            rethrowIfFatal(t);
            return new Attempt<>(null, t);
        }
    }

    public static Attempt<Void> run(VoidAction action) {
        try {
            action.run();
            return DONE;
        } catch (Throwable t) {
            rethrowIfFatal(t);
            return new Attempt<>(null, t);
        }
    }

    public static <T> Attempt<T> failed(Throwable failure) {
        return new Attempt<>(null, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public Optional<T> result() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(failure);
    }

    /** Short description of the failure for log lines, {@code "ok"} on success. */
    public String describe() {
        if (failure == null)
            return "ok";
        String message = failure.getMessage();
        return message == null
                ? failure.getClass().getName()
                : failure.getClass().getName() + ": " + message;
    }

    static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    private static void rethrowIfFatal(Throwable t) {
        if (isFatal(t)) {
            throw (VirtualMachineError) t;
        }
    }
}
