package org.snoozeql.scheduler.util.error;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

/**
 * Turns the message codes collected in {@link ValidationErrorResult} into the strings a rejected
 * request gets back. Codes come from the services (an invalid operator, a regex that doesn't
 * compile, an over-long pattern) and from the constraint messages on the request models, whose
 * single argument is the JSON field name, e.g. "The value for wake_cron is not specified.".
 */
@Component
public class MessageBundleResourceHelper {

  @Autowired
  @Qualifier("messageSource")
  private MessageSource messageSource;

  /**
   * @param key - message code from messages.properties, e.g. "data.invalid.regex"
   * @param arguments - values for the {0}, {1}... placeholders, in order
   * @return the resolved message; a code missing from the bundle comes back as
   *     <code>"["+key+"]"</code> so the client still sees which check failed
   */
  public String lookupMessage(String key, Object... arguments) {
    return messageSource.getMessage(
        key, arguments, "[" + key + "]", LocaleContextHolder.getLocale());
  }
}
