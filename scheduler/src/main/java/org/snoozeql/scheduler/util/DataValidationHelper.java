package org.snoozeql.scheduler.util;

import java.util.Collection;

/** Helper class for validating the data */
public class DataValidationHelper {

  /**
   * Checks if the specified object is null.
   *
   * @param object
   * @return true if not null otherwise false
   */
  public static boolean isNotNull(Object object) {
    return object != null;
  }

  /**
   * Checks if specified string is not empty (not null and not blank)
   *
   * @param string
   * @return true or false
   */
  public static boolean isNotEmpty(String string) {
    return (isNotNull(string) && !string.isEmpty());
  }

  /**
   * Checks if specified collection is not empty (not null and not empty)
   *
   * @param collection
   * @return
   */
  public static boolean isNotEmpty(Collection<?> collection) {
    return (isNotNull(collection) && !collection.isEmpty());
  }

  public static boolean isWithinMaxLength(String string, int maxLength) {
    return string == null || string.length() <= maxLength;
  }
}
