package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema
public class RegexValidationRequest {

  @Schema(example = "^prod-.*$")
  @JsonProperty(value = "pattern")
  private String pattern;

  public RegexValidationRequest() {}

  public RegexValidationRequest(String pattern) {
    this.pattern = pattern;
  }

  public String getPattern() {
    return pattern;
  }

  public void setPattern(String pattern) {
    this.pattern = pattern;
  }
}
