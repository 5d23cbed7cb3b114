package org.snoozeql.scheduler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.snoozeql.scheduler.rest.model.Instance;
import org.snoozeql.scheduler.rest.model.Matcher;
import org.snoozeql.scheduler.rest.model.Selector;

/** Decides which instances a schedule's selectors apply to. */
public class SelectorMatcher {

  public static final String NO_CONDITIONS = "No conditions";

  private static final String CLAUSE_SEPARATOR = " AND ";

  /**
   * Checks an instance against a list of selectors.
   *
   * @param instance
   * @param selectors
   * @param operator - {@link SelectorOperatorEnum#AND}: every selector must match, {@link
   *     SelectorOperatorEnum#OR}: one is enough
   * @return false for an empty selector list, whatever the operator
   */
  public static boolean matchInstance(
      Instance instance, List<Selector> selectors, SelectorOperatorEnum operator) {
    if (selectors == null || selectors.isEmpty()) {
      return false;
    }

    for (Selector selector : selectors) {
      boolean matches = matchSelector(instance, selector);
      if (operator == SelectorOperatorEnum.OR && matches) {
        return true;
      }
      if (operator == SelectorOperatorEnum.AND && !matches) {
        return false;
      }
    }

    return operator == SelectorOperatorEnum.AND;
  }

  /**
   * Checks an instance against one selector. Every field the selector populates must match; a
   * selector populating nothing matches every instance.
   */
  public static boolean matchSelector(Instance instance, Selector selector) {
    if (isConstrained(selector.getName())
        && !matchField(instance.getName(), selector.getName())) {
      return false;
    }

    if (selector.getProvider() != null
        && selector.getProvider() != ProviderEnum.classify(instance.getProvider())) {
      return false;
    }

    if (isConstrained(selector.getRegion())
        && !matchField(instance.getRegion(), selector.getRegion())) {
      return false;
    }

    if (isConstrained(selector.getEngine())
        && !matchField(instance.getEngine(), selector.getEngine())) {
      return false;
    }

    if (selector.getTags() != null) {
      Map<String, String> instanceTags =
          instance.getTags() == null ? Collections.emptyMap() : instance.getTags();

      for (Map.Entry<String, Matcher> tag : selector.getTags().entrySet()) {
        if (!isConstrained(tag.getValue())) {
          continue;
        }
        String tagValue = instanceTags.get(tag.getKey());
        if (tagValue == null || !matchField(tagValue, tag.getValue())) {
          return false;
        }
      }
    }

    return true;
  }

  /**
   * Applies a matcher to a field value. An empty pattern always matches. "exact" is case
   * sensitive; the other types ignore case. A regex that doesn't compile matches nothing; use
   * {@link #validateRegex(String)} to report it.
   *
   * @param value - the instance field, null is read as ""
   * @param matcher
   * @return true if the value satisfies the matcher
   */
  public static boolean matchField(String value, Matcher matcher) {
    if (!isConstrained(matcher)) {
      return true;
    }

    try {
      return matcher.getType().apply(value == null ? "" : value, matcher.getPattern());
    } catch (PatternSyntaxException e) {
      return false;
    }
  }

  /**
   * @param pattern
   * @return an empty string when the pattern is empty or compiles, the reason otherwise
   */
  public static String validateRegex(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      return "";
    }
    try {
      Pattern.compile(pattern);
      return "";
    } catch (PatternSyntaxException e) {
      return e.getDescription();
    }
  }

  /** The shape a new selector starts with in the editor: an empty "contains" name matcher. */
  public static Selector createEmptySelector() {
    Selector selector = new Selector();
    selector.setName(new Matcher("", MatchTypeEnum.CONTAINS));
    return selector;
  }

  /**
   * Describes a selector, e.g. {@code name starts with "prod" AND provider is AWS}.
   *
   * @return the description, or {@link #NO_CONDITIONS} when the selector populates nothing
   */
  public static String describeSelectorRule(Selector selector) {
    List<String> clauses = new ArrayList<>();

    if (isConstrained(selector.getName())) {
      clauses.add(describeClause("name", selector.getName()));
    }
    if (selector.getProvider() != null) {
      clauses.add(
          "provider is " + selector.getProvider().getJsonValue().toUpperCase(Locale.ROOT));
    }
    if (isConstrained(selector.getRegion())) {
      clauses.add(describeClause("region", selector.getRegion()));
    }
    if (isConstrained(selector.getEngine())) {
      clauses.add(describeClause("engine", selector.getEngine()));
    }
    if (selector.getTags() != null) {
      for (Map.Entry<String, Matcher> tag : selector.getTags().entrySet()) {
        if (isConstrained(tag.getValue())) {
          clauses.add(describeClause("tag \"" + tag.getKey() + "\"", tag.getValue()));
        }
      }
    }

    return clauses.isEmpty() ? NO_CONDITIONS : String.join(CLAUSE_SEPARATOR, clauses);
  }

  private static String describeClause(String field, Matcher matcher) {
    return field + " " + matcher.getType().getVerb() + " \"" + matcher.getPattern() + "\"";
  }

  private static boolean isConstrained(Matcher matcher) {
    return matcher != null && matcher.hasPattern();
  }
}
