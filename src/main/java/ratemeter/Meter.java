package ratemeter;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;

/**
 * A metric tracking the rate of occurrence of an event.
 *
 * <p>Rolling averages are tracked the way the Linux kernel tracks its load average: every
 * {@value #TICK_INTERVAL_SECONDS} seconds the events seen since the previous tick are folded into five
 * exponentially-weighted moving averages. There is no timer thread. Whichever caller first notices that an
 * interval has elapsed performs the tick, and intervals nobody was around to see are made up with decay.
 *
 * <p>thread-safe; {@link #mark(long)} takes no lock unless it wins a tick
 */
public class Meter {

    static final long TICK_INTERVAL_SECONDS = 5;

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private static final LogHelper LOG = new LogHelper(Meter.class);

    // config
    private final Ticker ticker;
    private final long startTime; // ticker nanos

    private final AtomicLong uncounted = new AtomicLong();
    private final AtomicLong lastTick = new AtomicLong(); // whole seconds since startTime

    private final Object lock = new Object();

    // guarded by lock
    private long count;
    private final Ewma rate10s = new Ewma(0.16);
    private final Ewma rate30s = new Ewma(0.5);
    private final Ewma rate1m = new Ewma(1);
    private final Ewma rate5m = new Ewma(5);
    private final Ewma rate15m = new Ewma(15);
    private final ImmutableList<Ewma> rates = ImmutableList.of(rate10s, rate30s, rate1m, rate5m, rate15m);

    /**
     * ctor
     */
    public Meter() {
        this(Ticker.systemTicker());
    }

    /**
     * ctor
     *
     * @param ticker monotonic time source
     */
    public Meter(Ticker ticker) {
        this.ticker = checkNotNull(ticker, "ticker");
        this.startTime = ticker.read();
    }

    /**
     * Marks a single occurrence of an event.
     */
    public void mark() {
        mark(1);
    }

    /**
     * Marks {@code n} occurrences of an event. Negative values are allowed.
     *
     * @param n
     */
    public void mark(long n) {
        tickIfNecessary();
        uncounted.addAndGet(n);
    }

    /**
     * Returns the number of events marked so far, including events not yet folded into the rates.
     */
    public long count() {
        synchronized (lock) {
            return count + uncounted.get();
        }
    }

    /**
     * Ten second rolling average, in events per second.
     */
    public double tenSecondRate() {
        return rate(rate10s);
    }

    /**
     * Thirty second rolling average, in events per second.
     */
    public double thirtySecondRate() {
        return rate(rate30s);
    }

    /**
     * One minute rolling average, in events per second.
     */
    public double oneMinuteRate() {
        return rate(rate1m);
    }

    /**
     * Five minute rolling average, in events per second.
     */
    public double fiveMinuteRate() {
        return rate(rate5m);
    }

    /**
     * Fifteen minute rolling average, in events per second.
     */
    public double fifteenMinuteRate() {
        return rate(rate15m);
    }

    /**
     * Mean rate since the meter was created, in events per second.
     *
     * <p>0 until an event is marked, and 0 while no time has elapsed
     */
    public double meanRate() {
        return meanRate(count());
    }

    /**
     * Reads the count and every rate under a single lock acquisition.
     */
    public MeterSnapshot snapshot() {
        tickIfNecessary();
        synchronized (lock) {
            final long total = count + uncounted.get();
            return new MeterSnapshot(total, rate10s.get(), rate30s.get(), rate1m.get(), rate5m.get(), rate15m.get(),
                    meanRate(total));
        }
    }

    private double rate(Ewma ewma) {
        tickIfNecessary();
        synchronized (lock) {
            return ewma.get();
        }
    }

    private double meanRate(long count) {
        if (count == 0)
            return 0;
        final long elapsed = ticker.read() - startTime;
        if (elapsed <= 0)
            return 0;
        return count / (elapsed / NANOS_PER_SECOND);
    }

    private void tickIfNecessary() {
        final long oldTick = lastTick.get();
        final long newTick = TimeUnit.NANOSECONDS.toSeconds(ticker.read() - startTime);
        final long age = newTick - oldTick;
        if (age < TICK_INTERVAL_SECONDS)
            return;

        final long newIntervalStartTick = newTick - age % TICK_INTERVAL_SECONDS;
        if (!lastTick.compareAndSet(oldTick, newIntervalStartTick)) {
            // another thread has already ticked for us
            trace("tick", oldTick, "lost");
            return;
        }

        final long requiredTicks = age / TICK_INTERVAL_SECONDS;
        final long delta;
        synchronized (lock) {
            delta = uncounted.getAndSet(0);
            count += delta;
            for (Ewma rate : rates) {
                rate.tick(delta);
                rate.decay(requiredTicks - 1);
            }
        }
        trace("tick", newIntervalStartTick, "requiredTicks", requiredTicks, "delta", delta);
    }

    @Override
    public String toString() {
        MeterSnapshot snapshot = snapshot();
        return String.format(Locale.ROOT, "%s(%.3f/%.3f/%.3f)", snapshot.count, snapshot.oneMinuteRate,
                snapshot.fiveMinuteRate, snapshot.fifteenMinuteRate);
    }

    private void trace(Object... args) {
        LOG.debug(args);
    }

}
