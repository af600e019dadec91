/*
 * Copyright (c) 2015 TSA Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.timeseries;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named series in insertion order. Bulk operations apply to each series on its
 * own and return a new group with the same names.
 */
public class TimeSeriesGroup implements Iterable<Map.Entry<String, TimeSeries>> {
  private final Map<String, TimeSeries> series = new LinkedHashMap<>();

  public TimeSeriesGroup() {}

  /** A group holding the given series in the map's iteration order. */
  public TimeSeriesGroup(Map<String, TimeSeries> series) {
    Preconditions.checkNotNull(series, "series");
    for (Map.Entry<String, TimeSeries> entry : series.entrySet()) {
      put(entry.getKey(), entry.getValue());
    }
  }

  /** Returns the named series, or null if the group has none by that name. */
  public TimeSeries get(String name) {
    return series.get(name);
  }

  /**
   * Stores the series under the name. A name already present keeps its
   * position; a new name goes last, including one that was {@link #remove removed}
   * earlier, which does not get its old position back.
   *
   * @return the series previously stored under the name, or null
   */
  public TimeSeries put(String name, TimeSeries value) {
    Preconditions.checkNotNull(name, "name");
    Preconditions.checkNotNull(value, "series %s", name);
    return series.put(name, value);
  }

  /**
   * Removes the named series and returns it, or null if there was none. The
   * name's position is dropped with it.
   */
  public TimeSeries remove(String name) {
    return series.remove(name);
  }

  public boolean containsKey(String name) {
    return series.containsKey(name);
  }

  public int size() {
    return series.size();
  }

  public boolean isEmpty() {
    return series.isEmpty();
  }

  public List<String> names() {
    return ImmutableList.copyOf(series.keySet());
  }

  /** A snapshot of the (name, series) pairs in insertion order. */
  public List<Map.Entry<String, TimeSeries>> items() {
    ImmutableList.Builder<Map.Entry<String, TimeSeries>> items = ImmutableList.builder();
    for (Map.Entry<String, TimeSeries> entry : series.entrySet()) {
      items.add(Maps.immutableEntry(entry.getKey(), entry.getValue()));
    }
    return items.build();
  }

  @Override
  public Iterator<Map.Entry<String, TimeSeries>> iterator() {
    return items().iterator();
  }

  /** The linear trend of every series. */
  public TimeSeriesGroup trend() {
    return trend(TimeSeries.LINEAR);
  }

  /** The polynomial trend of the given order of every series. */
  public TimeSeriesGroup trend(int order) {
    TimeSeriesGroup result = new TimeSeriesGroup();
    for (Map.Entry<String, TimeSeries> entry : series.entrySet()) {
      result.put(entry.getKey(), entry.getValue().trend(order));
    }
    return result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("series", series).toString();
  }
}
