// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.audit;

import java.util.Arrays;

/** How much of a request is recorded in the audit log. */
public enum AuditLevel {
  NONE("None"),
  METADATA("Metadata"),
  REQUEST("Request"),
  REQUEST_RESPONSE("RequestResponse");

  private final String value;

  AuditLevel(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Returns the level whose policy file name is the specified value.
   * @param value a level name, such as "Metadata"
   * @return the matching level
   * @throws IllegalArgumentException if no level has that name
   */
  public static AuditLevel fromValue(String value) {
    return Arrays.stream(values())
          .filter(level -> level.value.equals(value))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("unknown audit level " + value));
  }

  @Override
  public String toString() {
    return value;
  }
}
