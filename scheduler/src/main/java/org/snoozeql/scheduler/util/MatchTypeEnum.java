package org.snoozeql.scheduler.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.regex.Pattern;

/** The ways a selector matcher compares its pattern against an instance field. */
public enum MatchTypeEnum {
  EXACT("exact", "equals") {
    @Override
    boolean apply(String value, String pattern) {
      return value.equals(pattern);
    }
  },
  CONTAINS("contains", "contains") {
    @Override
    boolean apply(String value, String pattern) {
      return lowerCase(value).contains(lowerCase(pattern));
    }
  },
  PREFIX("prefix", "starts with") {
    @Override
    boolean apply(String value, String pattern) {
      return lowerCase(value).startsWith(lowerCase(pattern));
    }
  },
  SUFFIX("suffix", "ends with") {
    @Override
    boolean apply(String value, String pattern) {
      return lowerCase(value).endsWith(lowerCase(pattern));
    }
  },
  REGEX("regex", "matches") {
    @Override
    boolean apply(String value, String pattern) {
      return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(value).find();
    }
  };

  private final String jsonValue;
  private final String verb;

  MatchTypeEnum(String jsonValue, String verb) {
    this.jsonValue = jsonValue;
    this.verb = verb;
  }

  /**
   * Compares a non-empty pattern against a value.
   *
   * @throws java.util.regex.PatternSyntaxException for an uncompilable {@link #REGEX} pattern
   */
  abstract boolean apply(String value, String pattern);

  @JsonValue
  public String getJsonValue() {
    return jsonValue;
  }

  /** The verb used in human-readable rule descriptions. */
  public String getVerb() {
    return verb;
  }

  @JsonCreator
  public static MatchTypeEnum getEnum(String str) {
    for (MatchTypeEnum value : values()) {
      if (value.getJsonValue().equals(str)) {
        return value;
      }
    }
    throw new IllegalArgumentException("No such a Enum:" + str);
  }

  private static String lowerCase(String str) {
    return str.toLowerCase(Locale.ROOT);
  }
}
