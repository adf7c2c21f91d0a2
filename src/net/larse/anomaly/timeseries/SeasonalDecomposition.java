package net.larse.anomaly.timeseries;

import com.google.common.base.Preconditions;

/**
 * Seasonal decomposition of a time series into trend, seasonal and residual components using
 * medians instead of loess fits, so that the spikes being searched for do not pull the
 * baseline.
 *
 * <ol>
 *   <li>trend: centered running median over the stl trend span;</li>
 *   <li>seasonal: median of the detrended values of each phase of the period;</li>
 *   <li>residual: series - trend - seasonal.</li>
 * </ol>
 *
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6, 3–73.
 */
public class SeasonalDecomposition {
  private final double[] trend;
  private final double[] seasonal;
  private final double[] residual;
  private final int period;
  private final int trendWindow;

  private SeasonalDecomposition(double[] trend, double[] seasonal, double[] residual,
      int period, int trendWindow) {
    this.trend = trend;
    this.seasonal = seasonal;
    this.residual = residual;
    this.period = period;
    this.trendWindow = trendWindow;
  }

  /** Decompose y using the default trend window for its length and period. */
  public static SeasonalDecomposition fit(double[] y, int period) {
    return fit(y, period, defaultTrendWindow(y.length, period));
  }

  /**
   * Decompose y with an explicit trend window. An even window is raised to the next odd value.
   *
   * @param y the series, at least two periods long
   * @param period number of observations per period
   * @param trendWindow span of the running median used for the trend
   */
  public static SeasonalDecomposition fit(double[] y, int period, int trendWindow) {
    Preconditions.checkArgument(period >= 1, "period must be positive: %s", period);
    Preconditions.checkArgument(y.length >= 2 * period,
        "series must contain at least 2 periods");
    Preconditions.checkArgument(trendWindow >= 1, "trend window must be positive: %s",
        trendWindow);
    int window = trendWindow % 2 == 0 ? trendWindow + 1 : trendWindow;

    double[] trend = TimeSeriesUtils.movingMedian(y, window);

    double[] detrended = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      detrended[i] = y[i] - trend[i];
    }
    double[] cycle = TimeSeriesUtils.cycleSubseriesMedians(detrended, period);

    double[] seasonal = new double[y.length];
    double[] residual = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      seasonal[i] = cycle[i % period];
      residual[i] = y[i] - trend[i] - seasonal[i];
    }
    return new SeasonalDecomposition(trend, seasonal, residual, period, window);
  }

  /** The stl trend span for a periodic seasonal component. */
  public static int defaultTrendWindow(int n, int period) {
    return TimeSeriesUtils.trendSpan(period, TimeSeriesUtils.periodicSeasonalSpan(n));
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getResidual() {
    return residual.clone();
  }

  public int getPeriod() {
    return period;
  }

  public int getTrendWindow() {
    return trendWindow;
  }

  public int size() {
    return residual.length;
  }
}
