package org.snoozeql.scheduler.service;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.snoozeql.scheduler.rest.model.CronDescription;
import org.snoozeql.scheduler.rest.model.CronPair;
import org.snoozeql.scheduler.rest.model.ScheduleGrid;
import org.snoozeql.scheduler.util.LogCaptureAppender;
import org.snoozeql.scheduler.util.TestDataSetupHelper;
import org.snoozeql.scheduler.util.error.ValidationErrorResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ScheduleGridManagerTest {

  @Autowired private ScheduleGridManager scheduleGridManager;

  @Autowired private ValidationErrorResult validationErrorResult;

  private LogCaptureAppender logCapture;

  @BeforeEach
  void beforeTest() {
    logCapture = LogCaptureAppender.attachTo(ScheduleGridManager.class);
  }

  @AfterEach
  void afterTest() {
    logCapture.detach();
  }

  @Test
  void gridToCron() {
    CronPair cronPair = scheduleGridManager.gridToCron(TestDataSetupHelper.generateWeeknightGrid());

    assertThat(cronPair, is(new CronPair("0 22 * * 1,2,3,4,5", "0 7 * * 1,2,3,4,5")));
  }

  @Test
  void gridToCron_emptyGrid() {
    assertThat(scheduleGridManager.gridToCron(scheduleGridManager.createEmptyGrid()), nullValue());
  }

  @Test
  void cronToGrid() {
    ScheduleGrid grid =
        scheduleGridManager.cronToGrid(new CronPair("0 22 * * 1,2,3,4,5", "0 7 * * 1,2,3,4,5"));

    assertThat(grid, is(TestDataSetupHelper.generateWeeknightGrid()));
    assertThat(logCapture.getMessages(Level.WARN), is(empty()));
  }

  @Test
  void cronToGrid_unreadableExpressions_giveEmptyGrid() {
    ScheduleGrid grid = scheduleGridManager.cronToGrid(new CronPair("0 22 * * 1-5", "0 7 * * 1-5"));

    assertThat(grid.isEmpty(), is(true));
    assertThat(validationErrorResult.hasErrors(), is(false));

    List<String> warnings = logCapture.getMessages(Level.WARN);
    assertThat(warnings, hasSize(1));
    assertThat(
        warnings.get(0),
        is("CRON pair sleep_cron='0 22 * * 1-5' wake_cron='0 7 * * 1-5' gives no sleep hours"));
  }

  @Test
  void summarize() {
    assertThat(
        scheduleGridManager.summarize(TestDataSetupHelper.generateWeeknightGrid()).getActiveDays(),
        is("Weekdays"));
  }

  @Test
  void describe() {
    CronDescription description =
        scheduleGridManager.describe(new CronPair("0 22 * * 1,2,3,4,5", "0 7 * * *"));

    assertThat(description.getSleep(), is("At 10pm on Mon, Tue, Wed, Thu, Fri"));
    assertThat(description.getWake(), is("At 7am every day"));
  }
}
