// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.util.List;

/** Asks each authorizer in turn; the first one with an opinion decides. */
public class UnionAuthorizer implements Authorizer {

  private final List<Authorizer> authorizers;

  public UnionAuthorizer(List<Authorizer> authorizers) {
    this.authorizers = List.copyOf(authorizers);
  }

  List<Authorizer> getAuthorizers() {
    return authorizers;
  }

  @Override
  public Decision authorize(RequestAttributes attributes) {
    for (Authorizer authorizer : authorizers) {
      Decision decision = authorizer.authorize(attributes);
      if (decision != Decision.NO_OPINION) {
        return decision;
      }
    }
    return Decision.NO_OPINION;
  }
}
