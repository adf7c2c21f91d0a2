package net.larse.anomaly.timeseries;

import com.google.common.base.Preconditions;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Guesses the seasonal period of a series from the granularity of its time stamps.
 *
 * The finest unit all time stamps are aligned to decides the period: yearly data has no
 * seasonality (1), quarterly 4, monthly 12, weekly 52, daily 7, hourly 24, and data on the
 * minute or on the second 60. If the series does not cover two such periods, 1 is returned.
 */
public final class PeriodEstimator {
  private PeriodEstimator() {}

  public static int estimateFromDates(Collection<LocalDate> dates) {
    List<LocalDateTime> times = new ArrayList<>(dates.size());
    for (LocalDate date : dates) {
      times.add(date.atStartOfDay());
    }
    return estimate(times);
  }

  public static int estimate(Collection<LocalDateTime> times) {
    Preconditions.checkArgument(!times.isEmpty(), "need at least one time stamp");

    boolean second = true;
    boolean minute = true;
    boolean hour = true;
    boolean day = true;
    boolean month = true;
    boolean quarter = true;
    boolean year = true;
    DayOfWeek weekday = null;
    boolean week = true;

    for (LocalDateTime t : times) {
      Preconditions.checkNotNull(t, "null time stamp");
      second &= t.getNano() == 0;
      minute &= second && t.getSecond() == 0;
      hour &= minute && t.getMinute() == 0;
      day &= hour && t.getHour() == 0;
      month &= day && t.getDayOfMonth() == 1;
      quarter &= month && t.getMonthValue() % 3 == 1;
      year &= quarter && t.getMonthValue() == 1;
      if (weekday == null) {
        weekday = t.getDayOfWeek();
      }
      week &= day && t.getDayOfWeek() == weekday;
    }

    int period;
    if (year) {
      period = 1;
    } else if (quarter) {
      period = 4;
    } else if (month) {
      period = 12;
    } else if (week) {
      period = 52;
    } else if (day) {
      period = 7;
    } else if (hour) {
      period = 24;
    } else if (minute || second) {
      period = 60;
    } else {
      period = 1;
    }

    return times.size() < 2 * period ? 1 : period;
  }
}
