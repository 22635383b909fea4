// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.client;

import java.io.Serial;

/** Thrown when an API client cannot be built from a client configuration. */
public class ClientConstructionException extends Exception {
  @Serial
  private static final long serialVersionUID  = 1L;

  public ClientConstructionException(String message) {
    super(message);
  }

  public ClientConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
