package org.snoozeql.scheduler.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DateHelperTest {

  @Test
  void gridDayAndCronDayConversionsAreInverse() {
    for (int gridDay = 0; gridDay < DateHelper.DAYS_PER_WEEK; gridDay++) {
      int cronDay = DateHelper.convertGridDayToCronDay(gridDay);
      assertThat(DateHelper.isValidCronDay(cronDay), is(true));
      assertThat(DateHelper.convertCronDayToGridDay(cronDay), is(gridDay));
    }
  }

  @Test
  void mondayIsCronDayOneAndSundayIsCronDayZero() {
    assertThat(DateHelper.convertGridDayToCronDay(0), is(1));
    assertThat(DateHelper.convertGridDayToCronDay(6), is(0));
    assertThat(DateHelper.convertCronDayToGridDay(0), is(6));
    assertThat(DateHelper.convertCronDayToGridDay(6), is(5));
  }

  @Test
  void getDayName() {
    assertThat(DateHelper.getDayName(0), is("Mon"));
    assertThat(DateHelper.getDayName(6), is("Sun"));
    assertThat(DateHelper.getDayName(7), is(""));
    assertThat(DateHelper.getDayName(-1), is(""));
  }

  @Test
  void weekdayAndWeekendDaysCannotBeChanged() {
    assertThrows(
        UnsupportedOperationException.class, () -> DateHelper.WEEKDAY_GRID_DAYS.set(0, 6));
    assertThrows(UnsupportedOperationException.class, () -> DateHelper.WEEKEND_GRID_DAYS.add(0));

    assertThat(DateHelper.WEEKDAY_GRID_DAYS, contains(0, 1, 2, 3, 4));
    assertThat(DateHelper.WEEKEND_GRID_DAYS, contains(5, 6));
  }

  @ParameterizedTest
  @CsvSource({"0, 12am", "7, 7am", "11, 11am", "12, 12pm", "13, 1pm", "22, 10pm", "23, 11pm"})
  void formatHourAs12HourTime(int hour, String expected) {
    assertThat(DateHelper.formatHour(hour), is(expected));
  }

  @Test
  void formatHourAs24HourTime() {
    assertThat(DateHelper.formatHour(7, true), is("07:00"));
    assertThat(DateHelper.formatHour(22, true), is("22:00"));
  }
}
