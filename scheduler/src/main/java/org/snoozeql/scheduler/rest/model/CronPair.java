package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import java.util.Objects;

/** The sleep and wake CRON expressions of a schedule. */
@Schema
public class CronPair {

  @Schema(required = true, example = "0 22 * * 1,2,3,4,5")
  @NotBlank(message = "data.value.not.specified")
  @JsonProperty(value = "sleep_cron")
  private String sleepCron;

  @Schema(required = true, example = "0 7 * * 1,2,3,4,5")
  @NotBlank(message = "data.value.not.specified")
  @JsonProperty(value = "wake_cron")
  private String wakeCron;

  public CronPair() {}

  public CronPair(String sleepCron, String wakeCron) {
    this.sleepCron = sleepCron;
    this.wakeCron = wakeCron;
  }

  public String getSleepCron() {
    return sleepCron;
  }

  public void setSleepCron(String sleepCron) {
    this.sleepCron = sleepCron;
  }

  public String getWakeCron() {
    return wakeCron;
  }

  public void setWakeCron(String wakeCron) {
    this.wakeCron = wakeCron;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CronPair that = (CronPair) o;
    return Objects.equals(sleepCron, that.sleepCron) && Objects.equals(wakeCron, that.wakeCron);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sleepCron, wakeCron);
  }

  @Override
  public String toString() {
    return "CronPair [sleepCron=" + sleepCron + ", wakeCron=" + wakeCron + "]";
  }
}
