package net.larse.anomaly.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TimeSeriesUtilsTest {
  @Test
  public void testNextOdd() {
    assertEquals(3, TimeSeriesUtils.nextOdd(0));
    assertEquals(3, TimeSeriesUtils.nextOdd(2));
    assertEquals(5, TimeSeriesUtils.nextOdd(4));
    assertEquals(11, TimeSeriesUtils.nextOdd(11));
  }

  @Test
  public void testTrendSpan() {
    assertEquals(11, TimeSeriesUtils.trendSpan(7, TimeSeriesUtils.periodicSeasonalSpan(30)));
    assertEquals(19, TimeSeriesUtils.trendSpan(12, TimeSeriesUtils.periodicSeasonalSpan(24)));
    assertEquals(37, TimeSeriesUtils.trendSpan(24, TimeSeriesUtils.periodicSeasonalSpan(48)));
    assertEquals(3, TimeSeriesUtils.trendSpan(1, TimeSeriesUtils.periodicSeasonalSpan(2)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTrendSpanBadPeriod() {
    TimeSeriesUtils.trendSpan(0, 21);
  }

  @Test
  public void testMovingMedianTruncatesAtEnds() {
    assertArrayEquals(new double[] {5.0, 2.0, 8.0, 3.0, 5.5},
        TimeSeriesUtils.movingMedian(new double[] {1, 9, 2, 8, 3}, 3), 0.0);
    assertArrayEquals(new double[] {2.0, 5.0, 3.0, 7.0, 4.0, 5.5, 4.0},
        TimeSeriesUtils.movingMedian(new double[] {1, 9, 2, 8, 3, 7, 4}, 5), 0.0);
  }

  @Test
  public void testMovingMedianIgnoresSpike() {
    double[] smoothed = TimeSeriesUtils.movingMedian(new double[] {1, 1, 1, 100, 1, 1, 1}, 3);
    for (double v : smoothed) {
      assertEquals(1.0, v, 0.0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMovingMedianEvenWindow() {
    TimeSeriesUtils.movingMedian(new double[] {1, 2, 3}, 2);
  }

  @Test
  public void testCycleSubseriesMedians() {
    // phase 0: 1 4 7 10, phase 1: 2 5 8, phase 2: 3 6 9
    double[] y = new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
    assertArrayEquals(new double[] {5.5, 5.0, 6.0},
        TimeSeriesUtils.cycleSubseriesMedians(y, 3), 0.0);
  }
}
