package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema
public class RegexValidationResult {

  @JsonProperty(value = "pattern")
  private String pattern;

  @JsonProperty(value = "valid")
  private boolean valid;

  @Schema(description = "Empty when the pattern is valid")
  @JsonProperty(value = "message")
  private String message;

  public RegexValidationResult() {}

  public RegexValidationResult(String pattern, String message) {
    this.pattern = pattern;
    this.message = message;
    this.valid = message.isEmpty();
  }

  public String getPattern() {
    return pattern;
  }

  public void setPattern(String pattern) {
    this.pattern = pattern;
  }

  public boolean isValid() {
    return valid;
  }

  public void setValid(boolean valid) {
    this.valid = valid;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }
}
