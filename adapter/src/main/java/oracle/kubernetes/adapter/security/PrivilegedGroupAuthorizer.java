// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.util.List;
import java.util.Set;

/** Allows every request from a member of one of the listed groups. */
public class PrivilegedGroupAuthorizer implements Authorizer {

  private final Set<String> groups;

  public PrivilegedGroupAuthorizer(List<String> groups) {
    this.groups = Set.copyOf(groups);
  }

  @Override
  public Decision authorize(RequestAttributes attributes) {
    return attributes.getUser().getGroups().stream().anyMatch(groups::contains)
          ? Decision.ALLOW
          : Decision.NO_OPINION;
  }
}
