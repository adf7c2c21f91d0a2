/*
 * Copyright (c) 2015 LCMS Project Authors.
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
package net.larse.anomaly.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import net.larse.anomaly.helper.ArrayHelper;
import net.larse.anomaly.timeseries.SeasonalDecomposition;

/**
 * Implements the seasonal hybrid ESD (S-H-ESD) anomaly detection of:
 * Hochenbaum, J., Vallis, O. S., and Kejariwal, A. (2017).
 * Automatic Anomaly Detection in the Cloud Via Statistical Learning. arXiv:1704.07706.
 *
 * <p> The series is split into trend, seasonal and residual components with medians, and the
 * residuals go through a generalized ESD test that uses the median and MAD. The removed values
 * up to the last significant round are filtered by direction and returned by position.
 *
 * <p> Instances only hold the options and can be shared between threads.
 */
public final class SeasonalHybridEsd {
  private static final Logger LOG = LoggerFactory.getLogger(SeasonalHybridEsd.class);

  /** Options of the detector. Values are checked when {@link #detect} runs. */
  public static final class Args {
    // Upper bound of the fraction of the series reported as anomalies, in [0, 1].
    double maxAnoms = 0.1;

    // Significance level of the ESD test, in (0, 1).
    double alpha = 0.05;

    Direction direction = Direction.BOTH;

    // Log progress at INFO instead of DEBUG.
    boolean verbose = false;

    // Span of the running median trend. 0 derives it from the period and length.
    int trendWindow = 0;

    public Args maxAnoms(double maxAnoms) {
      this.maxAnoms = maxAnoms;
      return this;
    }

    public Args alpha(double alpha) {
      this.alpha = alpha;
      return this;
    }

    public Args direction(Direction direction) {
      this.direction = Preconditions.checkNotNull(direction);
      return this;
    }

    /** Same as {@link #direction(Direction)} with "pos", "neg" or "both". */
    public Args direction(String direction) {
      this.direction = Direction.fromString(direction);
      return this;
    }

    public Args verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Args trendWindow(int trendWindow) {
      this.trendWindow = trendWindow;
      return this;
    }

    public double getMaxAnoms() {
      return maxAnoms;
    }

    public double getAlpha() {
      return alpha;
    }

    public Direction getDirection() {
      return direction;
    }

    public boolean isVerbose() {
      return verbose;
    }

    public int getTrendWindow() {
      return trendWindow;
    }

    Args copy() {
      Args copy = new Args();
      copy.maxAnoms = maxAnoms;
      copy.alpha = alpha;
      copy.direction = direction;
      copy.verbose = verbose;
      copy.trendWindow = trendWindow;
      return copy;
    }
  }

  private final Args args;

  public SeasonalHybridEsd() {
    this(new Args());
  }

  public SeasonalHybridEsd(Args args) {
    this.args = args.copy();
  }

  public Args getArgs() {
    return args.copy();
  }

  /**
   * Find the anomalies of a series.
   *
   * @param values the observations, in time order and at a fixed frequency
   * @param period number of observations per seasonal cycle
   * @return the anomalies, ordered by position
   * @throws IllegalArgumentException if the series is shorter than two periods or an option is
   *     out of range
   * @throws SeriesDataException if a value is NaN
   */
  public List<Anomaly> detect(double[] values, int period) {
    validate(values, period);

    if (args.maxAnoms == 0) {
      return ImmutableList.of();
    }

    double[] series = values.clone();
    int n = series.length;
    int maxOutliers = Math.max(1, (int) Math.floor(args.maxAnoms * n));

    progress("Running seasonal decomposition of {} values with period {}", n, period);
    SeasonalDecomposition decomposition = args.trendWindow > 0
        ? SeasonalDecomposition.fit(series, period, args.trendWindow)
        : SeasonalDecomposition.fit(series, period);

    progress("Testing up to {} outliers at alpha {}", maxOutliers, args.alpha);
    GeneralizedEsd.Result result = new GeneralizedEsd(args.alpha, args.verbose)
        .test(decomposition.getResidual(), maxOutliers);

    List<Anomaly> anomalies = assemble(result.getOutliers(), args.direction);
    progress("Found {} anomalies", anomalies.size());
    return anomalies;
  }

  /** Parameter checks first, then the full NaN scan. */
  private void validate(double[] values, int period) {
    Preconditions.checkNotNull(values, "values");
    Preconditions.checkArgument(period >= 1, "period must be positive");
    Preconditions.checkArgument(values.length >= 2L * period,
        "series must contain at least 2 periods");
    Preconditions.checkArgument(args.maxAnoms >= 0 && args.maxAnoms <= 1,
        "max_anoms must be between 0 and 1");
    Preconditions.checkArgument(args.alpha > 0 && args.alpha < 1,
        "alpha must be between 0 and 1");
    Preconditions.checkArgument(args.direction != null,
        "direction must be pos, neg, or both");

    int nan = ArrayHelper.firstNaN(values);
    if (nan >= 0) {
      throw new SeriesDataException("series contains NANs", nan);
    }
  }

  /** Keep the outliers on the requested side and order them by position. */
  static List<Anomaly> assemble(List<GeneralizedEsd.Candidate> outliers, Direction direction) {
    List<Anomaly> anomalies = new ArrayList<>();
    for (GeneralizedEsd.Candidate candidate : outliers) {
      if (direction.accepts(candidate.sign)) {
        anomalies.add(new Anomaly(candidate.position, candidate.score, candidate.sign));
      }
    }
    anomalies.sort(Comparator.comparingInt(Anomaly::getPosition));
    return ImmutableList.copyOf(anomalies);
  }

  private void progress(String format, Object... arguments) {
    if (args.verbose) {
      LOG.info(format, arguments);
    } else {
      LOG.debug(format, arguments);
    }
  }
}
