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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.TDistributionImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import net.larse.anomaly.helper.ArrayHelper;
import net.larse.anomaly.helper.RobustStatistics;

/**
 * Implements the generalized extreme studentized deviate test of:
 * Rosner, B. (1983). Percentage Points for a Generalized ESD Many-Outlier Procedure.
 * Technometrics, 25(2), 165-172.
 *
 * <p> The mean and standard deviation of the original test are replaced by the median and the
 * scaled MAD, as in the hybrid ESD of Hochenbaum, Vallis and Kejariwal (2017), Automatic
 * Anomaly Detection in the Cloud Via Statistical Learning.
 *
 * <p> Every round removes the most extreme value from a working copy of the sample and records
 * its test statistic together with the round's critical value. Once all rounds ran, the
 * outliers are the values removed up to the last round whose statistic exceeds its critical
 * value, even if earlier rounds did not. A smaller outlier can be masked by a larger one and
 * only become significant after the larger one is gone.
 */
public final class GeneralizedEsd {
  private static final Logger LOG = LoggerFactory.getLogger(GeneralizedEsd.class);

  private final double alpha;
  private final boolean verbose;

  public GeneralizedEsd(double alpha) {
    this(alpha, false);
  }

  public GeneralizedEsd(double alpha, boolean verbose) {
    Preconditions.checkArgument(alpha > 0 && alpha < 1, "alpha must be in (0, 1): %s", alpha);
    this.alpha = alpha;
    this.verbose = verbose;
  }

  /** A value removed during one round of the test. */
  public static final class Candidate {
    // position in the sample handed to test().
    public final int position;
    // |x - median| / mad at the time of removal.
    public final double score;
    // +1 above the median of the working set, -1 otherwise.
    public final int sign;

    Candidate(int position, double score, int sign) {
      this.position = position;
      this.score = score;
      this.sign = sign;
    }
  }

  /** Test statistic and critical value of one round. */
  public static final class TestRound {
    public final double testStatistic;
    public final double criticalValue;

    TestRound(double testStatistic, double criticalValue) {
      this.testStatistic = testStatistic;
      this.criticalValue = criticalValue;
    }

    public boolean isSignificant() {
      return testStatistic > criticalValue;
    }
  }

  /** Outcome of the test: everything removed, and how much of it is significant. */
  public static final class Result {
    private final List<Candidate> candidates;
    private final List<TestRound> rounds;
    private final int lastSignificantRound;

    Result(List<Candidate> candidates, List<TestRound> rounds, int lastSignificantRound) {
      this.candidates = ImmutableList.copyOf(candidates);
      this.rounds = ImmutableList.copyOf(rounds);
      this.lastSignificantRound = lastSignificantRound;
    }

    /** All removed values, in removal order, one per round that ran. */
    public List<Candidate> getCandidates() {
      return candidates;
    }

    public List<TestRound> getRounds() {
      return rounds;
    }

    /** 1-based index of the last round whose statistic exceeds its critical value, 0 if none. */
    public int getLastSignificantRound() {
      return lastSignificantRound;
    }

    /** The outliers in removal order. */
    public List<Candidate> getOutliers() {
      return candidates.subList(0, lastSignificantRound);
    }
  }

  /**
   * Run up to maxOutliers rounds of the test over sample. The array is not modified.
   *
   * <p> Rounds stop early when the MAD of the remaining values is zero, since no value can then
   * be scored, or when a round would have less than one degree of freedom.
   */
  public Result test(double[] sample, int maxOutliers) {
    Preconditions.checkArgument(maxOutliers >= 0, "maxOutliers must not be negative: %s",
        maxOutliers);
    int n = sample.length;
    List<Candidate> candidates = new ArrayList<>();
    List<TestRound> rounds = new ArrayList<>();
    if (maxOutliers == 0 || n == 0) {
      return new Result(candidates, rounds, 0);
    }

    DoubleArrayList working = new DoubleArrayList(sample);
    IntArrayList positions = new IntArrayList(n);
    for (int i = 0; i < n; i++) {
      positions.add(i);
    }

    for (int i = 1; i <= maxOutliers; i++) {
      if (n - i - 1 < 1) {
        progress("Stopping at round {}: not enough observations left", i);
        break;
      }
      double[] values = working.toDoubleArray();
      double center = RobustStatistics.median(values);
      double sigma = RobustStatistics.mad(values, center);
      // Constant remainder, nothing can be scored anymore.
      if (sigma == 0.0) {
        progress("Stopping at round {}: MAD of remaining values is zero", i);
        break;
      }

      double[] scores = new double[values.length];
      for (int j = 0; j < values.length; j++) {
        scores[j] = Math.abs(values[j] - center) / sigma;
      }
      int extreme = ArrayHelper.argMax(scores);
      double value = values[extreme];
      Candidate candidate = new Candidate(
          positions.getInt(extreme), scores[extreme], value > center ? 1 : -1);

      working.removeDouble(extreme);
      positions.removeInt(extreme);

      TestRound round = new TestRound(candidate.score, criticalValue(n, i, alpha));
      candidates.add(candidate);
      rounds.add(round);
      progress("Round {}: position {} statistic {} critical value {}",
          i, candidate.position, round.testStatistic, round.criticalValue);
    }

    int last = lastSignificantRound(rounds);
    progress("{} of {} rounds kept as outliers", last, rounds.size());
    return new Result(candidates, rounds, last);
  }

  /** Backward scan for the last round whose statistic exceeds its critical value. */
  @VisibleForTesting
  static int lastSignificantRound(List<TestRound> rounds) {
    for (int i = rounds.size(); i > 0; i--) {
      if (rounds.get(i - 1).isSignificant()) {
        return i;
      }
    }
    return 0;
  }

  /**
   * Two sided critical value lambda of round i for a sample of n values:
   * t * (n - i) / sqrt((n - i - 1 + t^2) * (n - i + 1)), with t the quantile of the Student t
   * distribution with n - i - 1 degrees of freedom at 1 - alpha / (2 (n - i + 1)).
   */
  @VisibleForTesting
  static double criticalValue(int n, int i, double alpha) {
    Preconditions.checkArgument(n - i - 1 >= 1, "need at least one degree of freedom");
    double p = 1.0 - alpha / (2.0 * (n - i + 1));
    double t;
    try {
      t = new TDistributionImpl(n - i - 1).inverseCumulativeProbability(p);
    } catch (MathException e) {
      // Only happens if the solver does not converge, which it does for p in (0, 1).
      throw new IllegalStateException("Couldn't compute the t quantile for p = " + p, e);
    }
    return t * (n - i) / Math.sqrt((n - i - 1 + t * t) * (n - i + 1));
  }

  private void progress(String format, Object... arguments) {
    if (verbose) {
      LOG.info(format, arguments);
    } else {
      LOG.debug(format, arguments);
    }
  }
}
