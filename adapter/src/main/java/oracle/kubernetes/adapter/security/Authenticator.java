// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.util.Optional;

/** Decides who made a request, from the bearer token it carried. */
@FunctionalInterface
public interface Authenticator {

  /**
   * Authenticates a request.
   * @param token the bearer token from the request, or null if it carried none
   * @return the caller, or empty if the token was rejected
   */
  Optional<UserInfo> authenticate(String token);

  /**
   * Returns an authenticator which accepts only requests without a token, as anonymous.
   */
  static Authenticator anonymousOnly() {
    return token -> token == null || token.isEmpty() ? Optional.of(UserInfo.anonymous()) : Optional.empty();
  }
}
