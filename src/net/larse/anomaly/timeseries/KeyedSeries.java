package net.larse.anomaly.timeseries;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import net.larse.anomaly.algorithms.Anomaly;
import net.larse.anomaly.algorithms.SeasonalHybridEsd;

/**
 * A series keyed by time stamps (or any other ordered key). The entries are sorted by key, so
 * the detector sees a plain sequence and its positions can be mapped back to keys.
 */
public final class KeyedSeries<K extends Comparable<? super K>> {
  private final List<K> keys;
  private final double[] values;

  private KeyedSeries(List<K> keys, double[] values) {
    this.keys = keys;
    this.values = values;
  }

  /**
   * Sort the entries of series by key.
   *
   * @throws NullPointerException if a key or a value is null
   */
  public static <K extends Comparable<? super K>> KeyedSeries<K> of(
      Map<K, ? extends Number> series) {
    List<Map.Entry<K, ? extends Number>> entries = new ArrayList<>(series.size());
    for (Map.Entry<K, ? extends Number> entry : series.entrySet()) {
      Preconditions.checkNotNull(entry.getKey(), "null key");
      Preconditions.checkNotNull(entry.getValue(), "null value for key %s", entry.getKey());
      entries.add(entry);
    }
    entries.sort((a, b) -> a.getKey().compareTo(b.getKey()));

    ImmutableList.Builder<K> keys = ImmutableList.builderWithExpectedSize(entries.size());
    double[] values = new double[entries.size()];
    for (int i = 0; i < entries.size(); i++) {
      keys.add(entries.get(i).getKey());
      values[i] = entries.get(i).getValue().doubleValue();
    }
    return new KeyedSeries<>(keys.build(), values);
  }

  /** The keys in ascending order. */
  public List<K> keys() {
    return keys;
  }

  /** The values in key order. */
  public double[] values() {
    return values.clone();
  }

  public int size() {
    return values.length;
  }

  public K keyAt(int position) {
    Preconditions.checkElementIndex(position, keys.size());
    return keys.get(position);
  }

  /** Run detector on the values and return the keys of the anomalies in ascending order. */
  public List<K> detect(SeasonalHybridEsd detector, int period) {
    List<Anomaly> anomalies = detector.detect(values, period);
    ImmutableList.Builder<K> result = ImmutableList.builderWithExpectedSize(anomalies.size());
    for (Anomaly anomaly : anomalies) {
      result.add(keys.get(anomaly.getPosition()));
    }
    return result.build();
  }
}
