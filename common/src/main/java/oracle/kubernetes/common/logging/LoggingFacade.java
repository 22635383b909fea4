// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.common.logging;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Centralized logging for the adapter. */
public class LoggingFacade {

  private static final StackWalker WALKER = StackWalker.getInstance();

  private final Logger logger;

  /**
   * Construct logging facade.
   *
   * @param logger logger
   */
  public LoggingFacade(Logger logger) {
    this.logger = logger;

    final Logger parentLogger = Logger.getAnonymousLogger().getParent();
    for (final Handler handler : parentLogger.getHandlers()) {
      if (handler instanceof ConsoleHandler) {
        handler.setFormatter(new LoggingFormatter());
      }
    }
  }

  /** Logs a method entry. The calling class and method names will be inferred. */
  public void entering() {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.logp(Level.FINER, details.clazz, details.method, "ENTRY");
    }
  }

  /**
   * Logs a method entry, with a list of arguments of interest. The calling class and method names
   * will be inferred. Warning: Depending on the nature of the arguments, it may be required to cast
   * those of type String to Object, to ensure that this variant is called as expected, instead of
   * one of those referenced below.
   *
   * @param params varargs list of objects to include in the log message
   */
  public void entering(Object... params) {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.logp(Level.FINER, details.clazz, details.method, "ENTRY", params);
    }
  }

  /** Logs a method exit. The calling class and method names will be inferred. */
  public void exiting() {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.logp(Level.FINER, details.clazz, details.method, "RETURN");
    }
  }

  /**
   * Logs a method exit, with a result object. The calling class and method names will be inferred.
   *
   * @param result object to log which is the result of the method call
   */
  public void exiting(Object result) {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.logp(Level.FINER, details.clazz, details.method, "RETURN", new Object[] {result});
    }
  }

  /**
   * Logs that an exception will be thrown. The calling class and method names will be inferred.
   *
   * @param pending an Exception that will be thrown
   */
  public void throwing(Throwable pending) {
    if (isFinerEnabled()) {
      CallerDetails details = inferCaller();
      logger.logp(Level.FINER, details.clazz, details.method, "THROW", pending);
    }
  }

  /**
   * Logs a message at the requested level. Normally, one of the level-specific methods should be
   * used instead.
   *
   * @param level Level at which log log the message
   * @param msg the message to log
   * @param params varargs list of objects to include in the log message
   */
  public void log(Level level, String msg, Object... params) {
    if (logger.isLoggable(level)) {
      CallerDetails details = inferCaller();
      logger.logp(level, details.clazz, details.method, msg, params);
    }
  }

  /**
   * Logs a message which requires parameters, along with an exception, at the requested level.
   *
   * @param level Level at which log log the message
   * @param msg the message to log
   * @param thrown an Exception to include in the logged message
   */
  public void log(Level level, String msg, Throwable thrown) {
    if (logger.isLoggable(level)) {
      CallerDetails details = inferCaller();
      logger.logp(level, details.clazz, details.method, msg, thrown);
    }
  }

  public void finest(String msg, Object... params) {
    log(Level.FINEST, msg, params);
  }

  public void finest(String msg, Throwable thrown) {
    log(Level.FINEST, msg, thrown);
  }

  public void finer(String msg, Object... params) {
    log(Level.FINER, msg, params);
  }

  public void finer(String msg, Throwable thrown) {
    log(Level.FINER, msg, thrown);
  }

  public void fine(String msg, Object... params) {
    log(Level.FINE, msg, params);
  }

  public void fine(String msg, Throwable thrown) {
    log(Level.FINE, msg, thrown);
  }

  public void config(String msg, Object... params) {
    log(Level.CONFIG, msg, params);
  }

  public void config(String msg, Throwable thrown) {
    log(Level.CONFIG, msg, thrown);
  }

  public void info(String msg, Object... params) {
    log(Level.INFO, msg, params);
  }

  public void info(String msg, Throwable thrown) {
    log(Level.INFO, msg, thrown);
  }

  public void warning(String msg, Object... params) {
    log(Level.WARNING, msg, params);
  }

  public void warning(String msg, Throwable thrown) {
    log(Level.WARNING, msg, thrown);
  }

  public void severe(String msg, Object... params) {
    log(Level.SEVERE, msg, params);
  }

  public void severe(String msg, Throwable thrown) {
    log(Level.SEVERE, msg, thrown);
  }

  public boolean isFinerEnabled() {
    return logger.isLoggable(Level.FINER);
  }

  public boolean isFineEnabled() {
    return logger.isLoggable(Level.FINE);
  }

  public Level getLevel() {
    return logger.getLevel();
  }

  public void setLevel(Level level) {
    logger.setLevel(level);
  }

  public Logger getUnderlyingLogger() {
    return logger;
  }

  /**
   * Formats a message from the logger's resource bundle. If the key is not found in the bundle,
   * the key itself is used as the pattern.
   *
   * @param msgId the message key
   * @param params parameters to substitute into the message
   * @return the formatted message
   */
  public String formatMessage(String msgId, Object... params) {
    String pattern = getPattern(msgId);
    if (params == null || params.length == 0) {
      return pattern;
    }
    return MessageFormat.format(pattern, params);
  }

  private String getPattern(String msgId) {
    ResourceBundle bundle = logger.getResourceBundle();
    if (bundle == null) {
      return msgId;
    }
    try {
      return bundle.getString(msgId);
    } catch (MissingResourceException e) {
      return msgId;
    }
  }

  private CallerDetails inferCaller() {
    return WALKER.walk(frames ->
        frames.dropWhile(f -> !isFacadeFrame(f.getClassName()))
            .dropWhile(f -> isFacadeFrame(f.getClassName()))
            .findFirst()
            .map(f -> new CallerDetails(f.getClassName(), f.getMethodName()))
            .orElse(new CallerDetails("", "")));
  }

  private static boolean isFacadeFrame(String className) {
    return LoggingFacade.class.getName().equals(className);
  }

  private static class CallerDetails {
    private final String clazz;
    private final String method;

    CallerDetails(String clazz, String method) {
      this.clazz = clazz;
      this.method = method;
    }
  }
}
