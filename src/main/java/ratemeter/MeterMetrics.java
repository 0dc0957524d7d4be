package ratemeter;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.ToDoubleFunction;

import com.google.common.base.Strings;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Publishes a {@link Meter} to a micrometer {@link MeterRegistry}.
 *
 * <p>registers {@code <name>.count} as a function counter and {@code <name>.rate} as one gauge per window,
 * tagged {@code window=10s|30s|1m|5m|15m|mean}
 *
 * <p>the rate gauges hold the meter strongly, which also keeps the function counter reporting
 */
public class MeterMetrics implements MeterBinder {

    public static final String BASE_UNIT = "events/second";

    // config
    private final Meter meter;
    private final String name;
    private final Tags tags;

    /**
     * ctor
     *
     * @param meter
     * @param name
     * @param tags key/value pairs
     */
    public MeterMetrics(Meter meter, String name, String... tags) {
        this(meter, name, Tags.of(tags));
    }

    /**
     * ctor
     *
     * @param meter
     * @param name
     * @param tags
     */
    public MeterMetrics(Meter meter, String name, Iterable<Tag> tags) {
        checkArgument(!Strings.isNullOrEmpty(name), "name must not be empty");
        this.meter = checkNotNull(meter, "meter");
        this.name = name;
        this.tags = Tags.of(checkNotNull(tags, "tags"));
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        log("bindTo", name, tags);

        FunctionCounter.builder(name + ".count", meter, Meter::count)
                //
                .tags(tags)
                //
                .description("events marked")
                //
                .register(registry);

        gauge(registry, "10s", Meter::tenSecondRate);
        gauge(registry, "30s", Meter::thirtySecondRate);
        gauge(registry, "1m", Meter::oneMinuteRate);
        gauge(registry, "5m", Meter::fiveMinuteRate);
        gauge(registry, "15m", Meter::fifteenMinuteRate);
        gauge(registry, "mean", Meter::meanRate);
    }

    private void gauge(MeterRegistry registry, String window, ToDoubleFunction<Meter> rate) {
        Gauge.builder(name + ".rate", meter, rate)
                //
                .tags(tags)
                //
                .tag("window", window)
                //
                .baseUnit(BASE_UNIT)
                //
                .strongReference(true)
                //
                .register(registry);
    }

    private void log(Object... args) {
        new LogHelper(this).log(args);
    }

}
