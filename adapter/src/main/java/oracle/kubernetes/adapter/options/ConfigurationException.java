// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.io.Serial;

/** Thrown when a group of options cannot be applied to the server configuration. */
public class ConfigurationException extends Exception {
  @Serial
  private static final long serialVersionUID  = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
