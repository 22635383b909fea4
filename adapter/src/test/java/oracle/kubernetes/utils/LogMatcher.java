// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.stream.Collectors;

import org.hamcrest.Description;
import org.hamcrest.TypeSafeDiagnosingMatcher;

/**
 * Matches a collection of captured adapter log records which contains a record with the expected
 * level and message key. Matching records are removed from the collection, so that any records
 * left over when the test completes can be reported as unexpected.
 */
public class LogMatcher extends TypeSafeDiagnosingMatcher<Collection<LogRecord>> {

  private final Level expectedLevel;
  private final String expectedMessage;
  private Object[] expectedParameters;

  private LogMatcher(Level expectedLevel, String expectedMessage) {
    this.expectedLevel = expectedLevel;
    this.expectedMessage = expectedMessage;
  }

  public static LogMatcher containsInfo(String expectedMessage) {
    return new LogMatcher(Level.INFO, expectedMessage);
  }

  public static LogMatcher containsWarning(String expectedMessage) {
    return new LogMatcher(Level.WARNING, expectedMessage);
  }

  public static LogMatcher containsSevere(String expectedMessage) {
    return new LogMatcher(Level.SEVERE, expectedMessage);
  }

  /**
   * Requires the matching record to carry each of the specified parameters, in any position.
   * @param expectedParameters the parameters
   * @return this matcher
   */
  public LogMatcher withParams(Object... expectedParameters) {
    this.expectedParameters = expectedParameters;
    return this;
  }

  @Override
  protected boolean matchesSafely(Collection<LogRecord> logRecords, Description mismatchDescription) {
    if (logRecords.removeIf(this::matches)) {
      return true;
    }

    List<String> candidates = logRecords.stream()
          .filter(r -> expectedMessage.equals(r.getMessage()))
          .map(this::describeParameters)
          .collect(Collectors.toList());
    if (candidates.isEmpty()) {
      mismatchDescription.appendText("no ").appendValue(expectedMessage).appendText(" message was logged");
    } else {
      mismatchDescription.appendText("found ").appendValue(expectedMessage)
            .appendText(" only with ").appendValueList("", ", ", "", candidates);
    }
    return false;
  }

  private boolean matches(LogRecord item) {
    return item.getLevel() == expectedLevel
          && expectedMessage.equals(item.getMessage())
          && (expectedParameters == null || getParameters(item).containsAll(Arrays.asList(expectedParameters)));
  }

  private List<Object> getParameters(LogRecord item) {
    return Optional.ofNullable(item.getParameters()).map(Arrays::asList).orElse(List.of());
  }

  private String describeParameters(LogRecord item) {
    return item.getLevel() + " " + getParameters(item);
  }

  @Override
  public void describeTo(Description description) {
    description.appendValue(expectedLevel).appendText(" message ").appendValue(expectedMessage);
    if (expectedParameters != null) {
      description.appendText(" with parameters ").appendValueList("[", ", ", "]", expectedParameters);
    }
  }
}
