// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

/** The steps of applying the server options, in the order they run. */
public enum ApplyStep {
  CERTIFICATE_GENERATION("error creating self-signed certificates"),
  SECURE_SERVING,
  AUTHENTICATION,
  AUTHORIZATION,
  AUDIT,
  CLIENT_CONSTRUCTION("failed to create real external clientset"),
  FEATURES;

  private final String messagePrefix;

  ApplyStep() {
    this(null);
  }

  ApplyStep(String messagePrefix) {
    this.messagePrefix = messagePrefix;
  }

  String describe(Throwable cause) {
    return messagePrefix == null ? cause.getMessage() : messagePrefix + ": " + cause.getMessage();
  }
}
