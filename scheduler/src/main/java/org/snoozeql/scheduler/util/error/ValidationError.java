package org.snoozeql.scheduler.util.error;

import java.util.Arrays;

class ValidationError {

  private final Object object;
  private final String errorMessageCode;
  private final Object[] errorMessageArguments;

  ValidationError(Object object, Object[] errorMessageArguments, String errorMessageCode) {
    this.object = object;
    this.errorMessageCode = errorMessageCode;
    this.errorMessageArguments = errorMessageArguments;
  }

  String getErrorMessageCode() {
    return errorMessageCode;
  }

  Object[] getErrorMessageArguments() {
    return errorMessageArguments;
  }

  @Override
  public String toString() {
    return "ValidationError [object="
        + object
        + ", errorMessageCode="
        + errorMessageCode
        + ", errorMessageArguments="
        + Arrays.toString(errorMessageArguments)
        + "]";
  }
}
