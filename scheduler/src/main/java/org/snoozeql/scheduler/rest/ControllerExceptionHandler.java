package org.snoozeql.scheduler.rest;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.snoozeql.scheduler.util.error.InvalidDataException;
import org.snoozeql.scheduler.util.error.ValidationErrorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@ControllerAdvice
public class ControllerExceptionHandler {
  private static final PropertyNamingStrategies.SnakeCaseStrategy JSON_NAMING =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  private Logger logger = LoggerFactory.getLogger(this.getClass());

  @Autowired private ValidationErrorResult validationErrorResult;

  @ExceptionHandler(Exception.class)
  public ResponseEntity<List<String>> handleException(HttpServletRequest req, Exception e) {
    logger.error("Internal Server Error", e);

    return new ResponseEntity<>(null, null, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  /** Constraint messages on the request models are message codes taking the JSON field name. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<List<String>> handleMethodArgumentNotValidException(
      HttpServletRequest req, MethodArgumentNotValidException e) {
    for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
      validationErrorResult.addFieldError(
          e.getBindingResult().getTarget(),
          fieldError.getDefaultMessage(),
          JSON_NAMING.translate(fieldError.getField()));
    }

    List<String> errors = validationErrorResult.getAllErrorMessages();
    return new ResponseEntity<>(errors, null, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<List<String>> handleMessageNotReadableException(
      HttpServletRequest req, Exception e) {
    logger.info("Unreadable request body for {}: {}", req.getRequestURI(), e.getMessage());

    return new ResponseEntity<>(null, null, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(InvalidDataException.class)
  public ResponseEntity<List<String>> handleValidationException(
      HttpServletRequest req, Exception e) {

    List<String> errors = validationErrorResult.getAllErrorMessages();
    return new ResponseEntity<>(errors, null, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(value = {HttpRequestMethodNotSupportedException.class})
  protected ResponseEntity<Object> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException e) {
    return new ResponseEntity<>(e.getMessage(), null, e.getStatusCode());
  }

  @ExceptionHandler(value = {NoResourceFoundException.class})
  protected ResponseEntity<Object> handleNoResourceFoundException(NoResourceFoundException e) {
    return new ResponseEntity<>(e.getMessage(), null, e.getStatusCode());
  }
}
