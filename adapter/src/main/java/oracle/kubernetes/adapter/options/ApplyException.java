// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.io.Serial;

/**
 * Thrown when applying the server options fails. Names the step that failed; every earlier step
 * has already changed the server configuration, and no later step has run.
 */
public class ApplyException extends Exception {
  @Serial
  private static final long serialVersionUID  = 1L;

  private final ApplyStep step;

  public ApplyException(ApplyStep step, Throwable cause) {
    super(step.describe(cause), cause);
    this.step = step;
  }

  public ApplyStep getStep() {
    return step;
  }

  /**
   * Returns true if the failure came from building a client, rather than from the options themselves.
   */
  public boolean isInfrastructureFailure() {
    return step == ApplyStep.CLIENT_CONSTRUCTION;
  }
}
