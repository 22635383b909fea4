// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.common.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Custom log formatter to format log messages in JSON format. */
public class LoggingFormatter extends Formatter {

  private static final String LOG_LEVEL = "level";
  private static final String TIMESTAMP = "timestamp";
  private static final String THREAD = "thread";
  private static final String SOURCE_CLASS = "class";
  private static final String SOURCE_METHOD = "method";
  private static final String TIME_IN_MILLIS = "timeInMillis";
  private static final String MESSAGE = "message";
  private static final String EXCEPTION = "exception";

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

  private final ObjectMapper mapper = new ObjectMapper();

  @Override
  public String format(LogRecord logRecord) {
    String sourceClassName;
    String sourceMethodName = "";
    if (logRecord.getSourceClassName() != null) {
      sourceClassName = logRecord.getSourceClassName();
      if (logRecord.getSourceMethodName() != null) {
        sourceMethodName = logRecord.getSourceMethodName();
      }
    } else {
      sourceClassName = logRecord.getLoggerName();
    }

    final String message = formatMessage(logRecord);
    String level = logRecord.getLevel().getLocalizedName();
    long rawTime = logRecord.getMillis();
    final String dateString = DATE_FORMAT.format(OffsetDateTime.ofInstant(logRecord.getInstant(),
            ZoneId.systemDefault()));

    Map<String, Object> map = new LinkedHashMap<>();
    map.put(TIMESTAMP, dateString);
    map.put(THREAD, Thread.currentThread().getId());
    map.put(LOG_LEVEL, level);
    map.put(SOURCE_CLASS, sourceClassName);
    map.put(SOURCE_METHOD, sourceMethodName);
    map.put(TIME_IN_MILLIS, rawTime);
    map.put(MESSAGE, message != null ? message : "");
    map.put(EXCEPTION, getStackTrace(logRecord.getThrown()));
    try {
      return mapper.writeValueAsString(map) + "\n";
    } catch (JsonProcessingException e) {
      String tmp =
          "{\"timestamp\":\"%1$s\",\"level\":\"%2$s\",\"class\":\"%3$s\",\"method\":\"format\","
              + "\"timeInMillis\":%4$d,\"message\":\"Exception while preparing json object\","
              + "\"exception\":\"%5$s\"}\n";
      return String.format(
          tmp,
          dateString,
          level,
          LoggingFormatter.class.getName(),
          rawTime,
          e.getLocalizedMessage());
    }
  }

  private String getStackTrace(Throwable thrown) {
    if (thrown == null) {
      return "";
    }
    StringWriter sw = new StringWriter();
    try (PrintWriter pw = new PrintWriter(sw)) {
      thrown.printStackTrace(pw);
    }
    return sw.toString();
  }
}
