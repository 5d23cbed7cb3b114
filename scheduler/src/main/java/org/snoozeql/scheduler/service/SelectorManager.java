package org.snoozeql.scheduler.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.snoozeql.scheduler.conf.SelectorConfiguration;
import org.snoozeql.scheduler.rest.model.FilterPreviewRequest;
import org.snoozeql.scheduler.rest.model.FilterPreviewResult;
import org.snoozeql.scheduler.rest.model.Instance;
import org.snoozeql.scheduler.rest.model.Matcher;
import org.snoozeql.scheduler.rest.model.RegexValidationResult;
import org.snoozeql.scheduler.rest.model.Selector;
import org.snoozeql.scheduler.util.DataValidationHelper;
import org.snoozeql.scheduler.util.MatchTypeEnum;
import org.snoozeql.scheduler.util.SelectorMatcher;
import org.snoozeql.scheduler.util.SelectorOperatorEnum;
import org.snoozeql.scheduler.util.error.InvalidDataException;
import org.snoozeql.scheduler.util.error.ValidationErrorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Service class for previewing, validating and describing instance selectors. */
@Service
public class SelectorManager {

  @Autowired private ValidationErrorResult validationErrorResult;
  @Autowired private SelectorConfiguration selectorConfiguration;

  private Logger logger = LoggerFactory.getLogger(this.getClass());

  public Selector createEmptySelector() {
    return SelectorMatcher.createEmptySelector();
  }

  /**
   * Applies the selectors of a request to its instances.
   *
   * @param request - selectors, operator ("and" when missing) and candidate instances
   * @return the matching instances with the matched and total counts
   * @throws InvalidDataException when the operator is neither "and" nor "or", or a selector
   *     pattern is rejected by {@link #validateSelectors(List)}
   */
  public FilterPreviewResult previewFilter(FilterPreviewRequest request) {
    SelectorOperatorEnum operator;
    try {
      operator = SelectorOperatorEnum.getEnum(request.getOperator());
    } catch (IllegalArgumentException e) {
      validationErrorResult.addFieldError(
          request, "data.invalid.operator", request.getOperator());
      throw new InvalidDataException(e);
    }

    List<Selector> selectors =
        request.getSelectors() == null ? new ArrayList<>() : request.getSelectors();
    List<Instance> instances =
        request.getInstances() == null ? new ArrayList<>() : request.getInstances();

    validatePatterns(selectors);
    for (int index = 0; index < instances.size(); index++) {
      if (instances.get(index) == null) {
        validationErrorResult.addFieldError(
            instances, "data.value.not.specified", "instances[" + index + "]");
      }
    }
    if (validationErrorResult.hasErrors()) {
      throw new InvalidDataException();
    }

    List<Instance> matched =
        instances.stream()
            .filter(instance -> SelectorMatcher.matchInstance(instance, selectors, operator))
            .collect(Collectors.toList());

    logger.info(
        "Selector preview matched {} of {} instances with {} selector(s), operator {}",
        matched.size(),
        instances.size(),
        selectors.size(),
        operator.getJsonValue());

    return new FilterPreviewResult(matched, instances.size());
  }

  /**
   * Checks every selector before it is saved: at least one selector, patterns within the
   * configured length and regex patterns that compile.
   *
   * @param selectors
   * @throws InvalidDataException listing every problem found
   */
  public void validateSelectors(List<Selector> selectors) {
    if (!DataValidationHelper.isNotEmpty(selectors)) {
      validationErrorResult.addFieldError(selectors, "data.value.not.specified", "selectors");
      throw new InvalidDataException();
    }

    validatePatterns(selectors);

    if (validationErrorResult.hasErrors()) {
      throw new InvalidDataException();
    }
  }

  /**
   * @param pattern
   * @return the verdict; patterns over the configured length are rejected without compiling
   */
  public RegexValidationResult validateRegex(String pattern) {
    if (!DataValidationHelper.isWithinMaxLength(
        pattern, selectorConfiguration.getMaxPatternLength())) {
      return new RegexValidationResult(
          pattern,
          "Pattern is longer than " + selectorConfiguration.getMaxPatternLength() + " characters");
    }
    return new RegexValidationResult(pattern, SelectorMatcher.validateRegex(pattern));
  }

  /**
   * @param selectors
   * @return one description per selector, in order
   * @throws InvalidDataException when an entry of the list is null
   */
  public List<String> describeSelectors(List<Selector> selectors) {
    List<String> descriptions = new ArrayList<>();
    if (selectors == null) {
      return descriptions;
    }

    for (int index = 0; index < selectors.size(); index++) {
      Selector selector = selectors.get(index);
      if (selector == null) {
        validationErrorResult.addFieldError(
            selectors, "data.value.not.specified", "selectors[" + index + "]");
      } else {
        descriptions.add(SelectorMatcher.describeSelectorRule(selector));
      }
    }

    if (validationErrorResult.hasErrors()) {
      throw new InvalidDataException();
    }
    return descriptions;
  }

  private void validatePatterns(List<Selector> selectors) {
    for (int index = 0; index < selectors.size(); index++) {
      Selector selector = selectors.get(index);
      int selectorNumber = index + 1;
      if (selector == null) {
        validationErrorResult.addFieldError(
            selectors, "data.value.not.specified", "selectors[" + index + "]");
        continue;
      }

      validateMatcher(selector, selectorNumber, "name", selector.getName());
      validateMatcher(selector, selectorNumber, "region", selector.getRegion());
      validateMatcher(selector, selectorNumber, "engine", selector.getEngine());
      if (selector.getTags() != null) {
        for (Map.Entry<String, Matcher> tag : selector.getTags().entrySet()) {
          validateMatcher(selector, selectorNumber, "tag " + tag.getKey(), tag.getValue());
        }
      }
    }
  }

  private void validateMatcher(
      Selector selector, int selectorNumber, String field, Matcher matcher) {
    if (matcher == null || !matcher.hasPattern()) {
      return;
    }

    if (!DataValidationHelper.isWithinMaxLength(
        matcher.getPattern(), selectorConfiguration.getMaxPatternLength())) {
      validationErrorResult.addFieldError(
          selector,
          "data.pattern.too.long",
          selectorNumber,
          field,
          selectorConfiguration.getMaxPatternLength());
      return;
    }

    if (matcher.getType() == MatchTypeEnum.REGEX) {
      String message = SelectorMatcher.validateRegex(matcher.getPattern());
      if (!message.isEmpty()) {
        logger.warn("Selector {} {} has an invalid regex: {}", selectorNumber, field, message);
        validationErrorResult.addFieldError(
            selector, "data.invalid.regex", selectorNumber, field, message);
      }
    }
  }
}
