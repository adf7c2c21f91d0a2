package net.larse.anomaly.timeseries;

import static org.junit.Assert.assertEquals;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class PeriodEstimatorTest {
  private static final LocalDateTime START = LocalDateTime.of(2020, 1, 1, 0, 0);

  @Test
  public void testDaily() {
    List<LocalDate> dates = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      dates.add(LocalDate.of(2020, 1, 1).plusDays(i));
    }
    assertEquals(7, PeriodEstimator.estimateFromDates(dates));
  }

  @Test
  public void testWeekly() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 110; i++) {
      times.add(START.plusWeeks(i));
    }
    assertEquals(52, PeriodEstimator.estimate(times));
  }

  @Test
  public void testMonthly() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 36; i++) {
      times.add(START.plusMonths(i));
    }
    assertEquals(12, PeriodEstimator.estimate(times));
  }

  @Test
  public void testQuarterly() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      times.add(START.plusMonths(3 * i));
    }
    assertEquals(4, PeriodEstimator.estimate(times));
  }

  @Test
  public void testYearly() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      times.add(START.plusYears(i));
    }
    assertEquals(1, PeriodEstimator.estimate(times));
  }

  @Test
  public void testHourly() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 72; i++) {
      times.add(START.plusHours(i));
    }
    assertEquals(24, PeriodEstimator.estimate(times));
  }

  @Test
  public void testMinutes() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      times.add(START.plusMinutes(i));
    }
    assertEquals(60, PeriodEstimator.estimate(times));
  }

  @Test
  public void testSeconds() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      times.add(START.plusSeconds(i));
    }
    assertEquals(60, PeriodEstimator.estimate(times));
  }

  @Test
  public void testSubSecond() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      times.add(START.plusNanos(1000L * i));
    }
    assertEquals(1, PeriodEstimator.estimate(times));
  }

  @Test
  public void testTooShortForPeriod() {
    List<LocalDateTime> times = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      times.add(START.plusDays(i));
    }
    assertEquals(1, PeriodEstimator.estimate(times));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmpty() {
    PeriodEstimator.estimate(Collections.emptyList());
  }
}
