// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

/** Decides whether an authenticated request may proceed. */
@FunctionalInterface
public interface Authorizer {

  Decision authorize(RequestAttributes attributes);
}
