package ratemeter;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Named meters sharing one time source.
 *
 * <p>thread-safe
 */
public class Meters implements MeterBinder {

  private final Ticker ticker; // config
  private final ConcurrentMap<String, Meter> meters = new ConcurrentHashMap<>();

  /**
   * ctor
   */
  public Meters() {
    this(Ticker.systemTicker());
  }

  /**
   * ctor
   *
   * @param ticker
   */
  public Meters(Ticker ticker) {
    this.ticker = checkNotNull(ticker, "ticker");
  }

  /**
   * Returns the meter registered under {@code name}, creating it on first use.
   */
  public Meter meter(String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "name must not be empty");
    return meters.computeIfAbsent(name, k -> {
      log("meter", k);
      return new Meter(ticker);
    });
  }

  public ImmutableSortedSet<String> names() {
    return ImmutableSortedSet.copyOf(meters.keySet());
  }

  public ImmutableSortedMap<String, MeterSnapshot> snapshots() {
    ImmutableSortedMap.Builder<String, MeterSnapshot> builder = ImmutableSortedMap.naturalOrder();
    meters.forEach((name, meter) -> builder.put(name, meter.snapshot()));
    return builder.build();
  }

  /**
   * Binds every meter registered so far; meters created afterwards are not bound.
   */
  @Override
  public void bindTo(MeterRegistry registry) {
    meters.forEach((name, meter) -> new MeterMetrics(meter, name).bindTo(registry));
  }

  private void log(Object... args) {
    new LogHelper(this).log(args);
  }

}
