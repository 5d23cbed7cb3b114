package org.snoozeql.scheduler.service;

import org.snoozeql.scheduler.rest.model.CronDescription;
import org.snoozeql.scheduler.rest.model.CronPair;
import org.snoozeql.scheduler.rest.model.GridSummary;
import org.snoozeql.scheduler.rest.model.ScheduleGrid;
import org.snoozeql.scheduler.util.GridCronConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Service class converting between the weekly grid and its CRON pair. */
@Service
public class ScheduleGridManager {

  private Logger logger = LoggerFactory.getLogger(this.getClass());

  public ScheduleGrid createEmptyGrid() {
    return GridCronConverter.createEmptyGrid();
  }

  /**
   * @param grid
   * @return the CRON pair, or null when the grid has no sleep hour
   */
  public CronPair gridToCron(ScheduleGrid grid) {
    CronPair cronPair = GridCronConverter.gridToCron(grid);
    if (cronPair == null) {
      logger.debug("Grid has no sleep hours, no CRON pair generated");
    } else {
      logger.debug("Grid converted to {}", cronPair);
    }
    return cronPair;
  }

  /**
   * Fills a grid from a CRON pair. Expressions that can't be read give an empty grid, as the
   * editor expects, and a warning.
   *
   * @param cronPair
   * @return the grid
   */
  public ScheduleGrid cronToGrid(CronPair cronPair) {
    ScheduleGrid grid =
        GridCronConverter.cronToGrid(cronPair.getSleepCron(), cronPair.getWakeCron());

    if (grid.isEmpty()) {
      logger.warn(
          "CRON pair sleep_cron='{}' wake_cron='{}' gives no sleep hours",
          cronPair.getSleepCron(),
          cronPair.getWakeCron());
    }
    return grid;
  }

  public GridSummary summarize(ScheduleGrid grid) {
    return GridCronConverter.formatGridSummary(grid);
  }

  public CronDescription describe(CronPair cronPair) {
    return new CronDescription(
        GridCronConverter.describeCron(cronPair.getSleepCron()),
        GridCronConverter.describeCron(cronPair.getWakeCron()));
  }
}
