package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.snoozeql.scheduler.util.DateHelper;
import org.snoozeql.scheduler.util.error.InvalidDataException;

/**
 * Weekly sleep/wake grid: 7 day rows (Monday first) of 24 hour cells. A cell is true when
 * instances should be asleep during that hour. Instances never change after construction.
 */
@Schema(
    type = "array",
    description = "7 rows (Mon..Sun) of 24 booleans, true = asleep during that hour")
public final class ScheduleGrid {

  private final boolean[][] cells;

  /**
   * @param cells - 7 rows of 24 cells, copied
   * @throws InvalidDataException if the matrix is not exactly 7x24
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public ScheduleGrid(boolean[][] cells) {
    if (cells == null || cells.length != DateHelper.DAYS_PER_WEEK) {
      throw new InvalidDataException(
          "Schedule grid must have " + DateHelper.DAYS_PER_WEEK + " day rows");
    }
    this.cells = new boolean[DateHelper.DAYS_PER_WEEK][];
    for (int day = 0; day < DateHelper.DAYS_PER_WEEK; day++) {
      if (cells[day] == null || cells[day].length != DateHelper.HOURS_PER_DAY) {
        throw new InvalidDataException(
            "Schedule grid row " + day + " must have " + DateHelper.HOURS_PER_DAY + " hours");
      }
      this.cells[day] = cells[day].clone();
    }
  }

  public static ScheduleGrid empty() {
    return new ScheduleGrid(new boolean[DateHelper.DAYS_PER_WEEK][DateHelper.HOURS_PER_DAY]);
  }

  @JsonValue
  public boolean[][] getCells() {
    boolean[][] copy = new boolean[DateHelper.DAYS_PER_WEEK][];
    for (int day = 0; day < DateHelper.DAYS_PER_WEEK; day++) {
      copy[day] = cells[day].clone();
    }
    return copy;
  }

  public boolean isSleep(int gridDay, int hour) {
    return cells[gridDay][hour];
  }

  /** The hours of a day marked as sleep, ascending. */
  public List<Integer> getSleepHours(int gridDay) {
    List<Integer> sleepHours = new ArrayList<>();
    for (int hour = 0; hour < DateHelper.HOURS_PER_DAY; hour++) {
      if (cells[gridDay][hour]) {
        sleepHours.add(hour);
      }
    }
    return sleepHours;
  }

  public boolean hasSleepHours(int gridDay) {
    for (boolean cell : cells[gridDay]) {
      if (cell) {
        return true;
      }
    }
    return false;
  }

  /** The days having at least one sleep hour, ascending. */
  public List<Integer> getActiveDays() {
    List<Integer> activeDays = new ArrayList<>();
    for (int day = 0; day < DateHelper.DAYS_PER_WEEK; day++) {
      if (hasSleepHours(day)) {
        activeDays.add(day);
      }
    }
    return activeDays;
  }

  public boolean isEmpty() {
    return getActiveDays().isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.deepEquals(cells, ((ScheduleGrid) o).cells);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(cells);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ScheduleGrid [");
    for (int day = 0; day < DateHelper.DAYS_PER_WEEK; day++) {
      sb.append(DateHelper.getDayName(day)).append('=').append(getSleepHours(day));
      if (day < DateHelper.DAYS_PER_WEEK - 1) {
        sb.append(", ");
      }
    }
    return sb.append(']').toString();
  }
}
