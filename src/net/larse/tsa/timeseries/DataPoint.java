package net.larse.tsa.timeseries;

import com.google.common.base.MoreObjects;

/** One observation: a timestamp and the value observed at it. */
public final class DataPoint {
  private final long timestamp;
  private final double value;

  public DataPoint(long timestamp, double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  public static DataPoint of(long timestamp, double value) {
    return new DataPoint(timestamp, value);
  }

  public long getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataPoint)) {
      return false;
    }
    DataPoint other = (DataPoint) o;
    return timestamp == other.timestamp
        && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(timestamp) + Double.hashCode(value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("timestamp", timestamp)
        .add("value", value)
        .toString();
  }
}
