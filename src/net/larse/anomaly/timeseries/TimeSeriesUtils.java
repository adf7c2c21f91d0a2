package net.larse.anomaly.timeseries;

import com.google.common.base.Preconditions;
import net.larse.anomaly.helper.RobustStatistics;

/**
 * Smoothing helpers used by the seasonal decomposition.
 *
 * The span rules follow the stl implementation from the R package:
 * R.B. Cleveland, W.S.Cleveland, J.E. McRae, and I. Terpenning,
 * STL: A Seasonal-Trend Decomposition Procedure Based on Loess,
 * Statistics Research Report, AT&T Bell Laboratories.
 *
 * The loess smoothers themselves are replaced by running medians.
 */
public class TimeSeriesUtils {
  /** Multiplier of the number of observations used for a "periodic" seasonal span. */
  static final int PERIODIC_SEASONAL_FACTOR = 10;

  /**
   * Smallest odd number that is at least value, and never less than 3.
   * The spans of the smoothers must be at least three and odd.
   */
  public static int nextOdd(int value) {
    int span = Math.max(3, value);
    if (span % 2 == 0) {
      span++;
    }
    return span;
  }

  /**
   * Seasonal span used when the seasonal component is treated as periodic. With such a large
   * span the seasonal smoother degenerates to a constant per cycle-subseries.
   */
  public static int periodicSeasonalSpan(int n) {
    return PERIODIC_SEASONAL_FACTOR * n + 1;
  }

  /**
   * Default trend span of stl: nextodd(ceiling(1.5 * np / (1 - 1.5 / ns))).
   *
   * @param np number of observations per period
   * @param ns seasonal span
   */
  public static int trendSpan(int np, int ns) {
    Preconditions.checkArgument(np >= 1, "period must be positive: %s", np);
    Preconditions.checkArgument(ns >= 3, "seasonal span must be at least 3: %s", ns);
    return nextOdd((int) Math.ceil(1.5 * np / (1.0 - 1.5 / ns)));
  }

  /**
   * Centered running median of y with an odd window. Close to the ends the window is truncated
   * to the observations that exist, so the result always has the length of y.
   */
  public static double[] movingMedian(double[] y, int window) {
    Preconditions.checkArgument(window >= 1 && window % 2 == 1,
        "window must be a positive odd number: %s", window);
    int half = window / 2;
    double[] smoothed = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      int left = Math.max(0, i - half);
      int right = Math.min(y.length, i + half + 1);
      smoothed[i] = RobustStatistics.median(y, left, right - left);
    }
    return smoothed;
  }

  /**
   * Median of each cycle-subseries: result[p] is the median of y[p], y[p + np], y[p + 2 np], ...
   */
  public static double[] cycleSubseriesMedians(double[] y, int np) {
    Preconditions.checkArgument(np >= 1 && np <= y.length,
        "period must be in [1, %s]: %s", y.length, np);
    double[] medians = new double[np];
    for (int j = 0; j < np; j++) {
      int k = (y.length - j - 1) / np + 1;
      double[] work = new double[k];
      for (int i = 0; i < k; i++) {
        work[i] = y[i * np + j];
      }
      medians[j] = RobustStatistics.median(work);
    }
    return medians;
  }
}
