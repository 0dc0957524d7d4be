package ratemeter;

import com.google.gson.JsonElement;

/**
 * Point-in-time view of a {@link Meter}; all rates in events per second.
 */
public final class MeterSnapshot {
  public final long count;
  public final double tenSecondRate;
  public final double thirtySecondRate;
  public final double oneMinuteRate;
  public final double fiveMinuteRate;
  public final double fifteenMinuteRate;
  public final double meanRate;

  MeterSnapshot(long count, double tenSecondRate, double thirtySecondRate, double oneMinuteRate,
      double fiveMinuteRate, double fifteenMinuteRate, double meanRate) {
    this.count = count;
    this.tenSecondRate = tenSecondRate;
    this.thirtySecondRate = thirtySecondRate;
    this.oneMinuteRate = oneMinuteRate;
    this.fiveMinuteRate = fiveMinuteRate;
    this.fifteenMinuteRate = fifteenMinuteRate;
    this.meanRate = meanRate;
  }

  public JsonElement toJson() {
    return RenderHelper.toJsonTree(this);
  }

  @Override
  public String toString() {
    return RenderHelper.toString(this);
  }
}
