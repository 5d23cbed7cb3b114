package org.snoozeql.scheduler.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Cloud provider of a database instance, as a selector compares it. */
public enum ProviderEnum {
  AWS("aws"),
  GCP("gcp");

  private final String jsonValue;

  ProviderEnum(String jsonValue) {
    this.jsonValue = jsonValue;
  }

  @JsonValue
  public String getJsonValue() {
    return jsonValue;
  }

  /**
   * Classifies a raw instance provider string, e.g. "aws_123456789012_us-east-1". Anything not
   * starting with "aws" is GCP.
   */
  public static ProviderEnum classify(String rawProvider) {
    if (rawProvider != null && rawProvider.startsWith(AWS.getJsonValue())) {
      return AWS;
    }
    return GCP;
  }

  @JsonCreator
  public static ProviderEnum getEnum(String str) {
    for (ProviderEnum value : values()) {
      if (value.getJsonValue().equals(str)) {
        return value;
      }
    }
    throw new IllegalArgumentException("No such a Enum:" + str);
  }
}
