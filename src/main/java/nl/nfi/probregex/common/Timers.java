package nl.nfi.probregex.common;

import java.time.Duration;

public final class Timers {

    private Timers() {
    }

    public static <X extends Exception> Duration time(final Statement<X> executable) throws X {
        final long start = System.nanoTime();
        executable.execute();
        return Duration.ofNanos(System.nanoTime() - start);
    }

    @FunctionalInterface
    public interface Statement<X extends Exception> {
        void execute() throws X;
    }
}
