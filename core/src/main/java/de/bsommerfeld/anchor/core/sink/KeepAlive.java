package de.bsommerfeld.anchor.core.sink;

/**
 * Process-wide sink for values whose only purpose is to be read.
 *
 * <p>
 * Storing into a volatile static field is a side effect no optimizer can
 * prove unobservable, so the computation that produced the value (a
 * reflective name lookup, a constructor call) stays in the compiled image.
 * The stored values are never read back by the application.
 */
public final class KeepAlive {

    // written from the single orchestrating thread, volatile for the optimizer, not for visibility
    private static volatile Object sink;
    private static volatile long counter;

    private KeepAlive() {
    }

    public static void accept(Object value) {
        sink = value;
        counter++;
    }

    public static void accept(Object first, Object second) {
        sink = first;
        sink = second;
        counter += 2;
    }

    /** Number of values accepted so far. Only used to make the sink observable in tests. */
    public static long accepted() {
        return counter;
    }
}
