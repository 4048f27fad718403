package com.typedumper.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Measures named stages of a run and reports each duration when the stage ends.
 *
 * <p>The duration is reported whether the stage returns normally or throws.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StageTimer timer = StageTimer.logging();
 * List<BinaryImage> images = timer.measure("Analyze binary data",
 *     () -> analyzer.loadFromFile(binary, metadata));
 * }</pre>
 */
public final class StageTimer {

    private static final Logger log = LoggerFactory.getLogger(StageTimer.class);

    private final BiConsumer<String, Duration> reporter;

    /**
     * Creates a timer with a custom reporter.
     *
     * @param reporter receives the stage name and its elapsed time
     */
    public StageTimer(BiConsumer<String, Duration> reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Creates a timer that logs every stage at INFO level.
     *
     * @return logging timer
     */
    public static StageTimer logging() {
        return new StageTimer((stage, elapsed) -> log.info("{}: {} sec", stage, format(elapsed)));
    }

    /**
     * Runs a stage that produces a value.
     *
     * @param stage stage name
     * @param action stage body
     * @param <T> result type
     * @param <E> exception type thrown by the stage
     * @return the stage result
     * @throws E if the stage fails
     */
    public <T, E extends Exception> T measure(String stage, Stage<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.call();
        } finally {
            reporter.accept(stage, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Runs a stage that produces no value.
     *
     * @param stage stage name
     * @param action stage body
     * @param <E> exception type thrown by the stage
     * @throws E if the stage fails
     */
    public <E extends Exception> void run(String stage, Action<E> action) throws E {
        this.<Object, E>measure(stage, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Formats a duration as seconds with two decimals.
     *
     * @param elapsed duration
     * @return formatted seconds (e.g. "1.25")
     */
    public static String format(Duration elapsed) {
        return String.format(Locale.ROOT, "%.2f", elapsed.toNanos() / 1_000_000_000.0);
    }

    /**
     * Stage body returning a value.
     *
     * @param <T> result type
     * @param <E> exception type
     */
    @FunctionalInterface
    public interface Stage<T, E extends Exception> {
        T call() throws E;
    }

    /**
     * Stage body without a result.
     *
     * @param <E> exception type
     */
    @FunctionalInterface
    public interface Action<E extends Exception> {
        void run() throws E;
    }
}
