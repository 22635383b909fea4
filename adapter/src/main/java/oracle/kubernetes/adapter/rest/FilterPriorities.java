// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import javax.ws.rs.Priorities;

/** Filter priority constants. Lower values run first on requests and last on responses. */
public class FilterPriorities {
  public static final int FLOW_CONTROL_FILTER_PRIORITY = Priorities.AUTHENTICATION - 200;
  public static final int AUDIT_FILTER_PRIORITY = Priorities.AUTHENTICATION - 100;
  public static final int SECURITY_FILTER_PRIORITY = Priorities.AUTHENTICATION;
  public static final int METRICS_FILTER_PRIORITY = Priorities.USER;

  private FilterPriorities() {
    // hide implicit public constructor
  }
}
