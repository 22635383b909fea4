// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.audit;

import java.io.IOException;
import java.io.Writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;

/** Writes audit events one per line, as JSON or in the legacy text format. */
public class LogAuditBackend implements AuditBackend {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  public static final String FORMAT_JSON = "json";
  public static final String FORMAT_LEGACY = "legacy";

  private final ObjectMapper mapper = new ObjectMapper();
  private final Writer writer;
  private final String format;
  private final boolean closeWriter;

  /**
   * Creates the backend.
   * @param writer where events are written
   * @param format {@link #FORMAT_JSON} or {@link #FORMAT_LEGACY}
   * @param closeWriter true if closing the backend should close the writer
   */
  public LogAuditBackend(Writer writer, String format, boolean closeWriter) {
    this.writer = writer;
    this.format = format;
    this.closeWriter = closeWriter;
  }

  public String getFormat() {
    return format;
  }

  @Override
  public synchronized void processEvent(AuditEvent event) {
    try {
      writer.write(FORMAT_LEGACY.equals(format) ? event.toLegacyLine() : mapper.writeValueAsString(event.toMap()));
      writer.write(System.lineSeparator());
      writer.flush();
    } catch (IOException e) {
      LOGGER.warning(MessageKeys.AUDIT_WRITE_FAILED, e);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (closeWriter) {
      writer.close();
    } else {
      writer.flush();
    }
  }
}
