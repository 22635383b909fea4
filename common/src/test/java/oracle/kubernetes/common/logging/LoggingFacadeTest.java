// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.common.logging;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

class LoggingFacadeTest {

  private MockLogger mockLogger;
  private LoggingFacade loggingFacade;

  @BeforeEach
  public void setup() {
    mockLogger = new MockLogger();
    loggingFacade = new LoggingFacade(mockLogger);
  }

  @Test
  void whenFinerEnabled_enteringIsLogged() {
    mockLogger.setLevel(Level.FINER);
    loggingFacade.entering();

    assertThat(mockLogger.isLogpCalled(), is(true));
    assertThat(mockLogger.messageLevel, is(Level.FINER));
    assertThat(mockLogger.message, is("ENTRY"));
  }

  @Test
  void whenFinerDisabled_enteringIsNotLogged() {
    loggingFacade.entering();

    assertThat(mockLogger.isLogpCalled(), is(false));
  }

  @Test
  void exitingWithResult_isLoggedWithResultAsParameter() {
    mockLogger.setLevel(Level.FINER);
    loggingFacade.exiting("result");

    assertThat(mockLogger.message, is("RETURN"));
    assertThat(mockLogger.messageParams, is(new Object[] {"result"}));
  }

  @Test
  void throwing_isLoggedWithThrowable() {
    mockLogger.setLevel(Level.FINER);
    loggingFacade.throwing(new IllegalStateException());

    assertThat(mockLogger.message, is("THROW"));
    assertThat(mockLogger.messageThrowable, notNullValue());
  }

  @Test
  void callerIsInferredFromStack() {
    loggingFacade.info("msg");

    assertThat(mockLogger.sourceClass, is(LoggingFacadeTest.class.getName()));
    assertThat(mockLogger.sourceMethod, is("callerIsInferredFromStack"));
  }

  @Test
  void verifyFineMessageNotLoggedAtDefaultLevel() {
    loggingFacade.fine("msg", "params");

    assertThat(mockLogger.isLogpCalled(), is(false));
  }

  @Test
  void verifyConfigMessageWithParamsLogged() {
    mockLogger.setLevel(Level.CONFIG);
    loggingFacade.config("msg", "params");

    assertThat(mockLogger.messageLevel, is(Level.CONFIG));
    assertThat(mockLogger.messageParams, is(new Object[] {"params"}));
  }

  @Test
  void verifyInfoMessageWithParamsLogged() {
    loggingFacade.info("msg", "params");

    assertThat(mockLogger.messageLevel, is(Level.INFO));
    assertThat(mockLogger.messageParams, is(new Object[] {"params"}));
  }

  @Test
  void verifyWarningMessageWithThrowableLogged() {
    loggingFacade.warning("msg", new Throwable());

    assertThat(mockLogger.messageLevel, is(Level.WARNING));
    assertThat(mockLogger.messageThrowable, notNullValue());
    assertThat(mockLogger.messageParams, nullValue());
  }

  @Test
  void verifySevereMessageWithThrowableLogged() {
    loggingFacade.severe("msg", new Throwable());

    assertThat(mockLogger.messageLevel, is(Level.SEVERE));
    assertThat(mockLogger.messageThrowable, notNullValue());
  }

  @Test
  void formatMessage_substitutesParameters() {
    assertThat(loggingFacade.formatMessage(MessageKeys.SERVER_STARTED, "https://0.0.0.0:443"),
        is("HTTPS server listening on https://0.0.0.0:443"));
  }

  @Test
  void formatMessage_withNoArgs_returnsPattern() {
    assertThat(loggingFacade.formatMessage(MessageKeys.SERVER_STOPPED), is("HTTPS server stopped"));
  }

  @Test
  void formatMessage_withUnknownKey_returnsKey() {
    assertThat(loggingFacade.formatMessage("no-such-key"), is("no-such-key"));
  }

  static class MockLogger extends Logger {

    Level level = Level.INFO;

    boolean logpCalled;
    Level messageLevel;
    String sourceClass;
    String sourceMethod;
    String message;
    Throwable messageThrowable;
    Object[] messageParams;

    public MockLogger() {
      super("MockLogger", "Adapter");
    }

    @Override
    public void setLevel(Level level) {
      this.level = level;
    }

    @Override
    public boolean isLoggable(Level level) {
      int levelValue = this.level.intValue();
      return level.intValue() >= levelValue && levelValue != Level.OFF.intValue();
    }

    @Override
    public void logp(Level level, String sourceClass, String sourceMethod, String msg, Object[] params) {
      record(level, sourceClass, sourceMethod, msg);
      messageParams = params;
    }

    @Override
    public void logp(Level level, String sourceClass, String sourceMethod, String msg, Throwable thrown) {
      record(level, sourceClass, sourceMethod, msg);
      messageThrowable = thrown;
    }

    @Override
    public void logp(Level level, String sourceClass, String sourceMethod, String msg) {
      record(level, sourceClass, sourceMethod, msg);
    }

    private void record(Level level, String sourceClass, String sourceMethod, String msg) {
      logpCalled = true;
      this.sourceClass = sourceClass;
      this.sourceMethod = sourceMethod;
      message = msg;
      messageLevel = level;
    }

    boolean isLogpCalled() {
      return logpCalled;
    }
  }
}
