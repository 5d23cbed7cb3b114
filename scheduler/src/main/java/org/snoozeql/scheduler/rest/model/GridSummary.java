package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/** Human-readable summary of a schedule grid. */
@Schema
public class GridSummary {

  @Schema(example = "Weekdays")
  @JsonProperty(value = "active_days")
  private String activeDays;

  @Schema(example = "10pm-7am")
  @JsonProperty(value = "sleep_hours")
  private String sleepHours;

  public GridSummary() {}

  public GridSummary(String activeDays, String sleepHours) {
    this.activeDays = activeDays;
    this.sleepHours = sleepHours;
  }

  public String getActiveDays() {
    return activeDays;
  }

  public void setActiveDays(String activeDays) {
    this.activeDays = activeDays;
  }

  public String getSleepHours() {
    return sleepHours;
  }

  public void setSleepHours(String sleepHours) {
    this.sleepHours = sleepHours;
  }

  @Override
  public String toString() {
    return "GridSummary [activeDays=" + activeDays + ", sleepHours=" + sleepHours + "]";
  }
}
