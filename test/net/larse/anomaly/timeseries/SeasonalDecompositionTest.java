package net.larse.anomaly.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Before;
import org.junit.Test;

public class SeasonalDecompositionTest {
  private double[] series;

  @Before
  public void setUp() throws Exception {
    series = new double[] {
        5.0, 9.0, 2.0, 9.0, 0.0, 6.0, 3.0, 8.0, 5.0, 18.0,
        7.0, 8.0, 8.0, 0.0, 2.0, -5.0, 0.0, 5.0, 6.0, 7.0,
        3.0, 6.0, 1.0, 4.0, 4.0, 4.0, 30.0, 7.0, 5.0, 8.0};
  }

  @Test
  public void testComponents() {
    SeasonalDecomposition decomposition = SeasonalDecomposition.fit(series, 7);
    assertEquals(11, decomposition.getTrendWindow());
    assertEquals(7, decomposition.getPeriod());
    assertEquals(30, decomposition.size());

    assertArrayEquals(new double[] {
        5.5, 5.0, 5.5, 5.0, 5.5, 6.0, 7.0, 7.0, 7.0, 6.0,
        6.0, 5.0, 5.0, 5.0, 6.0, 5.0, 5.0, 3.0, 3.0, 4.0,
        4.0, 4.0, 5.0, 5.0, 5.0, 4.5, 5.0, 4.5, 5.0, 6.0},
        decomposition.getTrend(), 1e-12);

    double[] cycle = new double[] {0.0, -2.0, -2.25, 1.5, 1.25, 3.0, -2.5};
    double[] seasonal = decomposition.getSeasonal();
    for (int i = 0; i < series.length; i++) {
      assertEquals(cycle[i % 7], seasonal[i], 1e-12);
    }

    double[] residual = decomposition.getResidual();
    assertEquals(14.25, residual[9], 1e-12);
    assertEquals(-8.0, residual[15], 1e-12);
    assertEquals(22.0, residual[26], 1e-12);
  }

  @Test
  public void testResidualIdentity() {
    SeasonalDecomposition decomposition = SeasonalDecomposition.fit(series, 5, 7);
    double[] trend = decomposition.getTrend();
    double[] seasonal = decomposition.getSeasonal();
    double[] residual = decomposition.getResidual();
    assertEquals(series.length, trend.length);
    assertEquals(series.length, seasonal.length);
    assertEquals(series.length, residual.length);
    for (int i = 0; i < series.length; i++) {
      assertEquals(series[i], trend[i] + seasonal[i] + residual[i], 1e-9);
    }
  }

  @Test
  public void testPurelySeasonalSeriesHasNoInteriorResidual() {
    double[] pattern = new double[] {3, -1, 4, -1, 5};
    double[] y = new double[40];
    for (int i = 0; i < y.length; i++) {
      y[i] = 10 + pattern[i % pattern.length];
    }
    double[] residual = SeasonalDecomposition.fit(y, 5, 5).getResidual();
    // the trend window is truncated within half a window of the ends
    for (int i = 2; i < y.length - 2; i++) {
      assertEquals(0.0, residual[i], 1e-12);
    }
  }

  @Test
  public void testEvenWindowIsRaised() {
    assertEquals(9, SeasonalDecomposition.fit(series, 7, 8).getTrendWindow());
  }

  @Test
  public void testComponentsAreCopies() {
    SeasonalDecomposition decomposition = SeasonalDecomposition.fit(series, 7);
    decomposition.getResidual()[0] = 1000;
    assertEquals(-0.5, decomposition.getResidual()[0], 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTooShort() {
    SeasonalDecomposition.fit(new double[] {1, 2, 3}, 2);
  }
}
