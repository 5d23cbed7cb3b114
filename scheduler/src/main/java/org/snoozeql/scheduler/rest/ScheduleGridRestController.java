package org.snoozeql.scheduler.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import org.snoozeql.scheduler.rest.model.CronDescription;
import org.snoozeql.scheduler.rest.model.CronPair;
import org.snoozeql.scheduler.rest.model.GridSummary;
import org.snoozeql.scheduler.rest.model.ScheduleGrid;
import org.snoozeql.scheduler.service.ScheduleGridManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Controller class for the schedule grid editor's conversions. */
@RestController
@RequestMapping(value = "/v1/schedules")
public class ScheduleGridRestController {

  @Autowired ScheduleGridManager scheduleGridManager;
  private final Logger logger = LoggerFactory.getLogger(this.getClass());

  @GetMapping("/grid")
  @Operation(summary = "Get an empty 7x24 grid, every hour awake.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "The empty grid.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ScheduleGrid.class)))
      })
  public ResponseEntity<ScheduleGrid> getEmptyGrid() {
    return new ResponseEntity<>(scheduleGridManager.createEmptyGrid(), HttpStatus.OK);
  }

  @PostMapping("/grid")
  @Operation(summary = "Fill a grid from a sleep/wake CRON pair.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "The grid; empty when the expressions can't be read.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ScheduleGrid.class))),
        @ApiResponse(responseCode = "400", description = "An expression is missing.")
      })
  public ResponseEntity<ScheduleGrid> cronToGrid(@RequestBody @Valid CronPair cronPair) {
    logger.info("Convert CRON pair to grid: {}", cronPair);

    return new ResponseEntity<>(scheduleGridManager.cronToGrid(cronPair), HttpStatus.OK);
  }

  @PostMapping("/cron")
  @Operation(summary = "Generate the sleep/wake CRON pair for a grid.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "The CRON pair.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CronPair.class))),
        @ApiResponse(responseCode = "204", description = "The grid has no sleep hours."),
        @ApiResponse(responseCode = "400", description = "The grid is not 7x24.")
      })
  public ResponseEntity<CronPair> gridToCron(@RequestBody ScheduleGrid grid) {
    logger.info("Convert grid to CRON pair");

    CronPair cronPair = scheduleGridManager.gridToCron(grid);

    // A grid without sleep hours has no CRON pair
    if (cronPair == null) {
      return new ResponseEntity<>(HttpStatus.NO_CONTENT);
    }
    return new ResponseEntity<>(cronPair, HttpStatus.OK);
  }

  @PostMapping("/summary")
  @Operation(summary = "Summarize a grid as active days and sleep hours.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "The summary.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = GridSummary.class))),
        @ApiResponse(responseCode = "400", description = "The grid is not 7x24.")
      })
  public ResponseEntity<GridSummary> summarize(@RequestBody ScheduleGrid grid) {
    return new ResponseEntity<>(scheduleGridManager.summarize(grid), HttpStatus.OK);
  }

  @PostMapping("/description")
  @Operation(summary = "Describe a sleep/wake CRON pair in words.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "The descriptions.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CronDescription.class))),
        @ApiResponse(responseCode = "400", description = "An expression is missing.")
      })
  public ResponseEntity<CronDescription> describe(@RequestBody @Valid CronPair cronPair) {
    return new ResponseEntity<>(scheduleGridManager.describe(cronPair), HttpStatus.OK);
  }
}
