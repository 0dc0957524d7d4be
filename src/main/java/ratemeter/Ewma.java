package ratemeter;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Exponentially-weighted moving average of an event rate, advanced in fixed steps of
 * {@link Meter#TICK_INTERVAL_SECONDS}.
 *
 * <p>not thread-safe; each instance is owned by one {@link Meter} and only touched under its lock
 */
final class Ewma {

    private static final double SECONDS_PER_MINUTE = 60.0;

    private final double alpha;

    private double rate; // events per second
    private boolean initialized;

    /**
     * ctor
     *
     * @param halfLifeMinutes
     */
    Ewma(double halfLifeMinutes) {
        checkArgument(halfLifeMinutes > 0, "halfLifeMinutes must be positive: %s", halfLifeMinutes);
        this.alpha = 1 - Math.exp(-Meter.TICK_INTERVAL_SECONDS / SECONDS_PER_MINUTE / halfLifeMinutes);
    }

    /**
     * Folds one interval's worth of events into the average.
     *
     * <p>the first call seeds the rate directly instead of blending from zero
     */
    void tick(long count) {
        final double instantRate = count / (double) Meter.TICK_INTERVAL_SECONDS;
        if (initialized) {
            rate += alpha * (instantRate - rate);
        } else {
            rate = instantRate;
            initialized = true;
        }
    }

    /**
     * Equivalent to calling {@code tick(0)} {@code ticks} times, in constant time.
     *
     * <pre>
     * x1 = x0 + alpha * (0 - x0) = x0 * (1 - alpha)
     * xn = x0 * (1 - alpha)^n
     * </pre>
     */
    void decay(long ticks) {
        checkArgument(ticks >= 0, "ticks must not be negative: %s", ticks);
        if (ticks > Integer.MAX_VALUE) {
            rate = 0; // saturate
            return;
        }
        rate *= Math.pow(1 - alpha, ticks);
    }

    double get() {
        return rate;
    }

}
