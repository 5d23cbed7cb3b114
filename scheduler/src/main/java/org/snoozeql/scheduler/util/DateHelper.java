package org.snoozeql.scheduler.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Helper class for the day and hour conventions shared by the grid and CRON expressions. */
public class DateHelper {

  public static final int DAYS_PER_WEEK = 7;
  public static final int HOURS_PER_DAY = 24;

  // Grid order, Monday first
  private static final String[] DAY_NAMES = {"Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun"};

  public static final List<Integer> WEEKDAY_GRID_DAYS =
      Collections.unmodifiableList(Arrays.asList(0, 1, 2, 3, 4));
  public static final List<Integer> WEEKEND_GRID_DAYS =
      Collections.unmodifiableList(Arrays.asList(5, 6));

  /**
   * Converts a grid day index (0=Monday..6=Sunday) to a CRON day-of-week (0=Sunday..6=Saturday).
   *
   * @param gridDay
   * @return the CRON day-of-week
   */
  public static int convertGridDayToCronDay(int gridDay) {
    return (gridDay + 1) % DAYS_PER_WEEK;
  }

  /**
   * Converts a CRON day-of-week (0=Sunday..6=Saturday) to a grid day index (0=Monday..6=Sunday).
   *
   * @param cronDay
   * @return the grid day index
   */
  public static int convertCronDayToGridDay(int cronDay) {
    return (cronDay + DAYS_PER_WEEK - 1) % DAYS_PER_WEEK;
  }

  /**
   * Abbreviated day name for a grid index.
   *
   * @param gridDay - 0=Monday..6=Sunday
   * @return the name, or an empty string for an index outside the week
   */
  public static String getDayName(int gridDay) {
    if (gridDay < 0 || gridDay >= DAYS_PER_WEEK) {
      return "";
    }
    return DAY_NAMES[gridDay];
  }

  /** Formats an hour as 12-hour time, e.g. "12am", "7am", "12pm", "10pm". */
  public static String formatHour(int hour) {
    return formatHour(hour, false);
  }

  public static String formatHour(int hour, boolean use24h) {
    if (use24h) {
      return String.format("%02d:00", hour);
    }

    String suffix = hour >= 12 ? "pm" : "am";
    int displayHour = hour == 0 ? 12 : hour > 12 ? hour - 12 : hour;
    return displayHour + suffix;
  }

  public static boolean isValidHour(int hour) {
    return hour >= 0 && hour < HOURS_PER_DAY;
  }

  public static boolean isValidCronDay(int cronDay) {
    return cronDay >= 0 && cronDay < DAYS_PER_WEEK;
  }
}
