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
package net.larse.anomaly.helper;

import com.google.common.base.Preconditions;
import org.apache.commons.math.stat.descriptive.rank.Median;

/**
 * Median based location and scale estimates.
 *
 * <p> The median absolute deviation is scaled by {@link #MAD_SCALE} so that it estimates the
 * standard deviation of normally distributed data.
 */
public final class RobustStatistics {
  /** 1 / Phi^-1(3/4), consistency constant of the MAD for the normal distribution. */
  public static final double MAD_SCALE = 1.4826;

  private RobustStatistics() {}

  /**
   * Median of values. For an even number of values it is the mean of the two middle ones. The
   * input array is not modified.
   */
  public static double median(double[] values) {
    return median(values, 0, values.length);
  }

  /** Median of values[begin, begin + length). */
  public static double median(double[] values, int begin, int length) {
    Preconditions.checkArgument(length > 0, "median of an empty sample");
    return new Median().evaluate(values, begin, length);
  }

  /** Scaled median absolute deviation around the sample median. */
  public static double mad(double[] values) {
    return mad(values, median(values));
  }

  /** Scaled median absolute deviation around a given center. */
  public static double mad(double[] values, double center) {
    double[] deviations = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - center);
    }
    return MAD_SCALE * median(deviations);
  }
}
