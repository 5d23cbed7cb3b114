package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema
public class CronDescription {

  @Schema(example = "At 10pm on Mon, Tue, Wed, Thu, Fri")
  @JsonProperty(value = "sleep")
  private String sleep;

  @Schema(example = "At 7am on Mon, Tue, Wed, Thu, Fri")
  @JsonProperty(value = "wake")
  private String wake;

  public CronDescription() {}

  public CronDescription(String sleep, String wake) {
    this.sleep = sleep;
    this.wake = wake;
  }

  public String getSleep() {
    return sleep;
  }

  public void setSleep(String sleep) {
    this.sleep = sleep;
  }

  public String getWake() {
    return wake;
  }

  public void setWake(String wake) {
    this.wake = wake;
  }
}
