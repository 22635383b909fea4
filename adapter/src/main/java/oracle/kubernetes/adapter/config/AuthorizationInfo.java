// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import oracle.kubernetes.adapter.security.Authorizer;

/** How the server authorizes authenticated requests. */
public class AuthorizationInfo {

  private Authorizer authorizer;

  public Authorizer getAuthorizer() {
    return authorizer;
  }

  public void setAuthorizer(Authorizer authorizer) {
    this.authorizer = authorizer;
  }
}
