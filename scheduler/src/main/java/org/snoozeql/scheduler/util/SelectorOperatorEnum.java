package org.snoozeql.scheduler.util;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a list of selectors is combined. */
public enum SelectorOperatorEnum {
  AND("and"),
  OR("or");

  private final String jsonValue;

  SelectorOperatorEnum(String jsonValue) {
    this.jsonValue = jsonValue;
  }

  @JsonValue
  public String getJsonValue() {
    return jsonValue;
  }

  /**
   * @param str - "and", "or", or null/empty for the default
   * @return the operator; {@link #AND} when none is given
   */
  public static SelectorOperatorEnum getEnum(String str) {
    if (!DataValidationHelper.isNotEmpty(str)) {
      return AND;
    }
    for (SelectorOperatorEnum value : values()) {
      if (value.getJsonValue().equals(str)) {
        return value;
      }
    }
    throw new IllegalArgumentException("No such a Enum:" + str);
  }
}
