// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import oracle.kubernetes.adapter.audit.AuditBackend;
import oracle.kubernetes.adapter.audit.AuditPolicy;
import oracle.kubernetes.adapter.audit.LogAuditBackend;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;
import org.apache.commons.io.FileUtils;

/**
 * Options for audit logging. Events are recorded only when both a policy file and a log path are
 * given; the policy decides which requests are recorded.
 */
public class AuditOptions implements OptionSet {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  static final String STDOUT_PATH = "-";
  static final List<String> ALLOWED_FORMATS = List.of(LogAuditBackend.FORMAT_JSON, LogAuditBackend.FORMAT_LEGACY);

  private String policyFile = "";
  private String logPath = "";
  private String logFormat = LogAuditBackend.FORMAT_JSON;

  public String getPolicyFile() {
    return policyFile;
  }

  public void setPolicyFile(String policyFile) {
    this.policyFile = policyFile;
  }

  public String getLogPath() {
    return logPath;
  }

  public void setLogPath(String logPath) {
    this.logPath = logPath;
  }

  public String getLogFormat() {
    return logFormat;
  }

  public void setLogFormat(String logFormat) {
    this.logFormat = logFormat;
  }

  @Override
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (!ALLOWED_FORMATS.contains(logFormat)) {
      errors.add(String.format("invalid audit log format %s, allowed formats are %s",
            logFormat, String.join(",", ALLOWED_FORMATS)));
    }
    return errors;
  }

  @Override
  public void addFlags(FlagSet flags) {
    flags.addStringFlag("audit-policy-file", "", "Path to the file that defines the audit policy configuration.",
          this::setPolicyFile);
    flags.addStringFlag("audit-log-path", "",
          "If set, all requests coming to the apiserver will be logged to this file. '-' means standard out.",
          this::setLogPath);
    flags.addStringFlag("audit-log-format", LogAuditBackend.FORMAT_JSON,
          "Format of saved audits. \"legacy\" indicates 1-line text format for each event. "
                + "\"json\" indicates structured json format. Known formats are legacy,json.",
          this::setLogFormat);
  }

  /**
   * Configures the audit policy and backend.
   * @param serverConfig receives the audit policy and backend
   * @throws ConfigurationException if the policy cannot be loaded or the log cannot be opened
   */
  public void applyTo(ServerConfig serverConfig) throws ConfigurationException {
    AuditPolicy policy = loadPolicy();
    if (logPath.isEmpty()) {
      setPolicy(serverConfig, policy);
      return;
    }

    if (policy == null) {
      LOGGER.warning(MessageKeys.AUDIT_LOG_WITHOUT_POLICY, logPath);
      return;
    }

    AuditBackend backend = new LogAuditBackend(openWriter(), logFormat, !STDOUT_PATH.equals(logPath));
    serverConfig.setAuditBackend(backend);
    serverConfig.setAuditPolicy(policy);
    LOGGER.info(MessageKeys.AUDIT_LOG_ENABLED, logFormat, STDOUT_PATH.equals(logPath) ? "stdout" : logPath);
  }

  private void setPolicy(ServerConfig serverConfig, AuditPolicy policy) {
    if (policy != null) {
      serverConfig.setAuditPolicy(policy);
    }
  }

  private AuditPolicy loadPolicy() throws ConfigurationException {
    if (policyFile.isEmpty()) {
      return null;
    }
    try {
      return AuditPolicy.load(new File(policyFile));
    } catch (IOException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  private Writer openWriter() throws ConfigurationException {
    if (STDOUT_PATH.equals(logPath)) {
      return new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
    }
    try {
      return new OutputStreamWriter(FileUtils.openOutputStream(new File(logPath), true), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigurationException(
            String.format("failed to open audit log file %s: %s", logPath, e.getMessage()), e);
    }
  }
}
