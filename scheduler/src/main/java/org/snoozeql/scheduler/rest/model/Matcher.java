package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Objects;
import org.snoozeql.scheduler.util.MatchTypeEnum;

/** A pattern and the way it is compared against one instance field. */
@Schema
public class Matcher {

  @Schema(description = "Empty pattern leaves the field unconstrained", example = "prod")
  @JsonProperty(value = "pattern")
  private String pattern = "";

  @Schema(example = "prefix", defaultValue = "contains")
  @JsonProperty(value = "type")
  private MatchTypeEnum type = MatchTypeEnum.CONTAINS;

  public Matcher() {}

  public Matcher(String pattern, MatchTypeEnum type) {
    this.pattern = pattern;
    setType(type);
  }

  public String getPattern() {
    return pattern;
  }

  public void setPattern(String pattern) {
    this.pattern = pattern;
  }

  public MatchTypeEnum getType() {
    return type;
  }

  /** A missing type means {@link MatchTypeEnum#CONTAINS}. */
  public void setType(MatchTypeEnum type) {
    this.type = type == null ? MatchTypeEnum.CONTAINS : type;
  }

  /** True when the pattern constrains the field at all. */
  public boolean hasPattern() {
    return pattern != null && !pattern.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Matcher that = (Matcher) o;
    return Objects.equals(pattern, that.pattern) && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(pattern, type);
  }

  @Override
  public String toString() {
    return "Matcher [pattern=" + pattern + ", type=" + type + "]";
  }
}
