package org.snoozeql.scheduler.util.error;

import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.context.annotation.RequestScope;

/**
 * Collects every reason a request's data was rejected, so a single 400 response can list them
 * all. One instance per request; the services add to it and {@code ControllerExceptionHandler}
 * renders it.
 */
@Component
@RequestScope
public class ValidationErrorResult {

  @Autowired MessageBundleResourceHelper messageBundleResourceHelper;
  private List<ValidationError> errorList; // null until the first error

  /**
   * @param object - the rejected value, kept for context
   * @param messageCode - key in messages.properties
   * @param arguments - placeholder values, usually the field name first
   */
  public void addFieldError(Object object, String messageCode, Object... arguments) {

    internalAddError(new ValidationError(object, arguments, messageCode));
  }

  private void internalAddError(ValidationError error) {
    if (errorList == null) {
      errorList = new ArrayList<>();
    }
    errorList.add(error);
  }

  /** @return the resolved messages in the order the errors were added */
  public List<String> getAllErrorMessages() {

    if (errorList == null || errorList.isEmpty()) {
      return new ArrayList<>();
    }

    List<String> errorMessages = new ArrayList<>(errorList.size());

    for (ValidationError error : errorList) {

      String resourceKey = error.getErrorMessageCode();
      Object[] messageArguments = error.getErrorMessageArguments();

      String errorMessage =
          messageBundleResourceHelper.lookupMessage(resourceKey, messageArguments);

      errorMessages.add(errorMessage);
    }
    return errorMessages;
  }

  /**
   * @return - true if this instance contains any errors
   */
  public boolean hasErrors() {
    return errorList != null && !errorList.isEmpty();
  }
}
