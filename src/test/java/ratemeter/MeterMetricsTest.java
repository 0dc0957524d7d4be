package ratemeter;

import static org.assertj.core.api.Assertions.*;

import java.util.concurrent.TimeUnit;

import com.google.common.testing.FakeTicker;

import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * MeterMetricsTest
 */
public class MeterMetricsTest {

  private final MeterRegistry registry = new SimpleMeterRegistry();

  private final FakeTicker ticker = new FakeTicker();
  private final Meter meter = new Meter(ticker);

  @Test
  public void bindsCountAndRates() throws Exception {
    new MeterMetrics(meter, "requests").bindTo(registry);

    meter.mark(1);
    ticker.advance(10, TimeUnit.SECONDS);
    meter.mark(2);

    assertThat(registry.get("requests.count").functionCounter().count()).isEqualTo(3.0);
    assertThat(registry.get("requests.rate").tag("window", "1m").gauge().value()).isCloseTo(0.1840, within(0.001));
    assertThat(registry.get("requests.rate").tag("window", "5m").gauge().value()).isCloseTo(0.1966, within(0.001));
    assertThat(registry.get("requests.rate").tag("window", "15m").gauge().value()).isCloseTo(0.1988, within(0.001));
    assertThat(registry.get("requests.rate").tag("window", "mean").gauge().value()).isCloseTo(0.3, within(0.001));

    assertThat(registry.find("requests.rate").gauges()).hasSize(6);
  }

  /**
   * the registry keeps a bound meter alive after the caller lets go of it
   */
  @Test
  public void boundMeterSurvivesGc() throws Exception {
    bindUnreferencedMeter("orphan");

    for (int i = 0; i < 5; ++i)
      System.gc();

    assertThat(registry.get("orphan.rate").tag("window", "1m").gauge().value()).isEqualTo(2.0);
    assertThat(registry.get("orphan.count").functionCounter().count()).isEqualTo(10.0);
  }

  private void bindUnreferencedMeter(String name) {
    Meter orphan = new Meter(ticker);
    new MeterMetrics(orphan, name).bindTo(registry);
    orphan.mark(10);
    ticker.advance(5, TimeUnit.SECONDS);
  }

  @Test
  public void gaugesCarryTagsAndUnit() throws Exception {
    new MeterMetrics(meter, "errors", "service", "api").bindTo(registry);

    Gauge gauge = registry.get("errors.rate").tags("service", "api", "window", "10s").gauge();
    assertThat(gauge.getId().getBaseUnit()).isEqualTo(MeterMetrics.BASE_UNIT);
    assertThat(gauge.value()).isZero();

    assertThat(registry.get("errors.count").tags(Tags.of("service", "api")).functionCounter().count()).isZero();
  }

  @Test
  public void rejectsBadConfig() throws Exception {
    assertThatThrownBy(() -> new MeterMetrics(meter, "")).isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("name");
    assertThatThrownBy(() -> new MeterMetrics(null, "requests")).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> new MeterMetrics(meter, "requests", "odd")).isInstanceOf(IllegalArgumentException.class);
  }

}
