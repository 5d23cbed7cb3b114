package org.snoozeql.scheduler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.snoozeql.scheduler.rest.model.CronPair;
import org.snoozeql.scheduler.rest.model.GridSummary;
import org.snoozeql.scheduler.rest.model.ScheduleGrid;
import org.snoozeql.scheduler.util.error.InvalidDataException;

/**
 * Converts between the weekly sleep/wake grid and the sleep/wake CRON expression pair.
 *
 * <p>A CRON pair can only carry one sleep hour and one wake hour for a set of days, so the grid to
 * CRON direction and the summary are approximations of the grid: the most common per-day pattern
 * wins. The grid stays the source of truth; the CRON pair is regenerated from it.
 */
public class GridCronConverter {

  public static final int DEFAULT_SLEEP_HOUR = 22;
  public static final int DEFAULT_WAKE_HOUR = 7;

  public static final String NO_ACTIVE_DAYS = "No active days";
  public static final String NO_SLEEP_HOURS = "No sleep hours";
  public static final String INVALID_CRON_EXPRESSION = "Invalid CRON expression";

  static final String MULTIPLE_BLOCKS = "multiple";
  static final String ALL_DAYS = "*";

  private static final String CRON_EXPRESSION_FORMAT = "0 %d * * %s";
  private static final Pattern DAY_NUMBER = Pattern.compile("\\d{1,9}");

  /** The hour and days of week read from one CRON expression. */
  static final class CronScheduleTime {
    private final int hour;
    private final List<Integer> daysOfWeek;

    CronScheduleTime(int hour, List<Integer> daysOfWeek) {
      this.hour = hour;
      this.daysOfWeek = daysOfWeek;
    }

    int getHour() {
      return hour;
    }

    List<Integer> getDaysOfWeek() {
      return daysOfWeek;
    }
  }

  public static ScheduleGrid createEmptyGrid() {
    return ScheduleGrid.empty();
  }

  /**
   * Builds the sleep/wake CRON pair for a grid.
   *
   * <p>Each day with sleep hours contributes a pattern: "first-last" when its sleep hours are
   * contiguous, "multiple" otherwise. The most frequent pattern gives the sleep and wake hours
   * (first seen wins a tie); "multiple" falls back to 22 and 7. The day-of-week field lists every
   * day having any sleep hour.
   *
   * @param grid
   * @return the CRON pair, or null when the grid has no sleep hour at all
   */
  public static CronPair gridToCron(ScheduleGrid grid) {
    Map<String, Integer> patternCounts = new LinkedHashMap<>();
    List<Integer> cronDays = new ArrayList<>();

    for (int gridDay = 0; gridDay < DateHelper.DAYS_PER_WEEK; gridDay++) {
      List<Integer> sleepHours = grid.getSleepHours(gridDay);
      if (sleepHours.isEmpty()) {
        continue;
      }

      String pattern =
          isContiguous(sleepHours)
              ? sleepHours.get(0) + "-" + sleepHours.get(sleepHours.size() - 1)
              : MULTIPLE_BLOCKS;
      patternCounts.merge(pattern, 1, Integer::sum);
      cronDays.add(DateHelper.convertGridDayToCronDay(gridDay));
    }

    if (patternCounts.isEmpty()) {
      return null;
    }

    String mostCommonPattern = null;
    int mostCommonCount = 0;
    for (Map.Entry<String, Integer> entry : patternCounts.entrySet()) {
      if (entry.getValue() > mostCommonCount) {
        mostCommonPattern = entry.getKey();
        mostCommonCount = entry.getValue();
      }
    }

    int sleepHour = DEFAULT_SLEEP_HOUR;
    int wakeHour = DEFAULT_WAKE_HOUR;
    if (!MULTIPLE_BLOCKS.equals(mostCommonPattern)) {
      String[] range = mostCommonPattern.split("-");
      sleepHour = Integer.parseInt(range[0]);
      wakeHour = Integer.parseInt(range[1]);
    }

    Collections.sort(cronDays);
    String daysOfWeek = cronDays.stream().map(String::valueOf).collect(Collectors.joining(","));

    return new CronPair(
        String.format(CRON_EXPRESSION_FORMAT, sleepHour, daysOfWeek),
        String.format(CRON_EXPRESSION_FORMAT, wakeHour, daysOfWeek));
  }

  /**
   * Fills a grid from a sleep/wake CRON pair. Every day named by either expression gets the sleep
   * window from the sleep hour up to (not including) the wake hour, wrapping past midnight when the
   * sleep hour is later than the wake hour. Equal hours give an empty window.
   *
   * <p>Never throws: input that can't be parsed gives an empty grid.
   *
   * @param sleepCron
   * @param wakeCron
   * @return the grid
   */
  public static ScheduleGrid cronToGrid(String sleepCron, String wakeCron) {
    boolean[][] cells = new boolean[DateHelper.DAYS_PER_WEEK][DateHelper.HOURS_PER_DAY];

    CronScheduleTime sleepTime;
    CronScheduleTime wakeTime;
    try {
      sleepTime = parseCronExpression(sleepCron);
      wakeTime = parseCronExpression(wakeCron);
    } catch (InvalidDataException e) {
      return new ScheduleGrid(cells);
    }

    int sleepHour = sleepTime.getHour();
    int wakeHour = wakeTime.getHour();

    Set<Integer> allCronDays = new TreeSet<>(sleepTime.getDaysOfWeek());
    allCronDays.addAll(wakeTime.getDaysOfWeek());

    for (int cronDay : allCronDays) {
      boolean[] day = cells[DateHelper.convertCronDayToGridDay(cronDay)];

      if (sleepHour > wakeHour) {
        markSleep(day, sleepHour, DateHelper.HOURS_PER_DAY);
        markSleep(day, 0, wakeHour);
      } else {
        markSleep(day, sleepHour, wakeHour);
      }
    }

    return new ScheduleGrid(cells);
  }

  /**
   * Summarizes a grid for display, e.g. "Weekdays" / "10pm-7am".
   *
   * <p>An hour belongs to the reported sleep range when at least half (rounded up) of the active
   * days sleep through it. The range runs from the first to the last such hour and is not checked
   * for gaps.
   *
   * @param grid
   * @return the summary
   */
  public static GridSummary formatGridSummary(ScheduleGrid grid) {
    List<Integer> activeDays = grid.getActiveDays();

    if (activeDays.isEmpty()) {
      return new GridSummary(NO_ACTIVE_DAYS, NO_SLEEP_HOURS);
    }

    String sleepHours = formatSleepHours(grid, activeDays);

    return new GridSummary(
        formatActiveDays(activeDays), sleepHours.isEmpty() ? NO_SLEEP_HOURS : sleepHours);
  }

  /**
   * Describes one CRON expression of a pair, e.g. "At 10pm on Mon, Tue" or "At 7am every day".
   *
   * @param cron
   * @return the description, or {@link #INVALID_CRON_EXPRESSION}
   */
  public static String describeCron(String cron) {
    CronScheduleTime scheduleTime;
    try {
      scheduleTime = parseCronExpression(cron);
    } catch (InvalidDataException e) {
      return INVALID_CRON_EXPRESSION;
    }

    if (!DateHelper.isValidHour(scheduleTime.getHour())) {
      return INVALID_CRON_EXPRESSION;
    }

    StringBuilder description =
        new StringBuilder("At ").append(DateHelper.formatHour(scheduleTime.getHour()));

    List<Integer> gridDays =
        scheduleTime.getDaysOfWeek().stream()
            .map(DateHelper::convertCronDayToGridDay)
            .distinct()
            .sorted()
            .collect(Collectors.toList());

    if (gridDays.size() == DateHelper.DAYS_PER_WEEK) {
      description.append(" every day");
    } else if (gridDays.isEmpty()) {
      description.append(" on no day");
    } else {
      description.append(" on ").append(joinDayNames(gridDays));
    }
    return description.toString();
  }

  /**
   * Reads the hour (second field) and day-of-week (fifth field, "*" when missing) of a CRON
   * expression.
   *
   * @throws InvalidDataException when there are fewer than 3 fields or the hour is not a number
   */
  static CronScheduleTime parseCronExpression(String cron) {
    if (cron == null) {
      throw new InvalidDataException("CRON expression is null");
    }

    String[] fields = cron.trim().split("\\s+");
    if (fields.length < 3) {
      throw new InvalidDataException("CRON expression has too few fields: " + cron);
    }

    int hour;
    try {
      hour = Integer.parseInt(fields[1]);
    } catch (NumberFormatException e) {
      throw new InvalidDataException("CRON hour is not a number: " + cron, e);
    }

    String daysOfWeek = fields.length > 4 ? fields[4] : ALL_DAYS;
    return new CronScheduleTime(hour, parseDaysOfWeek(daysOfWeek));
  }

  /**
   * Expands a day-of-week field. Only "*" and comma separated day numbers are understood; tokens
   * that are not a day number 0-6 (ranges like "1-5" included) are dropped.
   *
   * <p>A token must be all digits: "1-5" gives no day at all rather than being read as day 1.
   */
  static List<Integer> parseDaysOfWeek(String daysOfWeek) {
    List<Integer> days = new ArrayList<>();

    if (ALL_DAYS.equals(daysOfWeek)) {
      for (int cronDay = 0; cronDay < DateHelper.DAYS_PER_WEEK; cronDay++) {
        days.add(cronDay);
      }
      return days;
    }

    for (String token : daysOfWeek.split(",")) {
      String trimmedToken = token.trim();
      if (!DAY_NUMBER.matcher(trimmedToken).matches()) {
        continue;
      }
      int cronDay = Integer.parseInt(trimmedToken);
      if (DateHelper.isValidCronDay(cronDay)) {
        days.add(cronDay);
      }
    }
    return days;
  }

  private static void markSleep(boolean[] day, int fromHour, int toHour) {
    int start = Math.max(fromHour, 0);
    int end = Math.min(toHour, DateHelper.HOURS_PER_DAY);
    for (int hour = start; hour < end; hour++) {
      day[hour] = true;
    }
  }

  private static boolean isContiguous(List<Integer> hours) {
    for (int index = 1; index < hours.size(); index++) {
      if (hours.get(index) != hours.get(index - 1) + 1) {
        return false;
      }
    }
    return true;
  }

  private static String formatActiveDays(List<Integer> activeDays) {
    if (activeDays.size() == 1) {
      return DateHelper.getDayName(activeDays.get(0));
    }

    if (activeDays.equals(DateHelper.WEEKDAY_GRID_DAYS)) {
      return "Weekdays";
    }

    if (activeDays.equals(DateHelper.WEEKEND_GRID_DAYS)) {
      return "Weekends";
    }

    if (activeDays.size() == DateHelper.DAYS_PER_WEEK) {
      return "Every day";
    }

    return joinDayNames(activeDays);
  }

  private static String joinDayNames(List<Integer> gridDays) {
    return gridDays.stream().map(DateHelper::getDayName).collect(Collectors.joining(", "));
  }

  private static String formatSleepHours(ScheduleGrid grid, List<Integer> activeDays) {
    int[] hourSleepCounts = new int[DateHelper.HOURS_PER_DAY];
    for (int gridDay : activeDays) {
      for (int hour = 0; hour < DateHelper.HOURS_PER_DAY; hour++) {
        if (grid.isSleep(gridDay, hour)) {
          hourSleepCounts[hour]++;
        }
      }
    }

    // majority of the active days, rounded up
    int threshold = (activeDays.size() + 1) / 2;

    List<Integer> commonSleepHours = new ArrayList<>();
    for (int hour = 0; hour < DateHelper.HOURS_PER_DAY; hour++) {
      if (hourSleepCounts[hour] >= threshold) {
        commonSleepHours.add(hour);
      }
    }

    if (commonSleepHours.isEmpty()) {
      return "";
    }

    int sleepStart = commonSleepHours.get(0);
    int sleepEnd = commonSleepHours.get(commonSleepHours.size() - 1);
    return DateHelper.formatHour(sleepStart) + "-" + DateHelper.formatHour(sleepEnd);
  }
}
