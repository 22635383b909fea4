// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.util.Locale;
import java.util.Objects;

/** The facts about a request that authorization decisions are based on. */
public class RequestAttributes {

  private final UserInfo user;
  private final String verb;
  private final String path;

  /**
   * Creates the attributes of a non-resource request.
   * @param user the authenticated caller
   * @param httpMethod the HTTP method, which is mapped to a Kubernetes verb
   * @param path the request path
   */
  public RequestAttributes(UserInfo user, String httpMethod, String path) {
    this.user = user;
    this.verb = toVerb(httpMethod);
    this.path = path.startsWith("/") ? path : "/" + path;
  }

  /**
   * Maps an HTTP method to the Kubernetes verb used in authorization and audit records.
   * @param httpMethod an HTTP method such as GET
   * @return the verb
   */
  public static String toVerb(String httpMethod) {
    switch (httpMethod.toUpperCase(Locale.ROOT)) {
      case "POST":
        return "create";
      case "PUT":
        return "update";
      case "PATCH":
        return "patch";
      case "DELETE":
        return "delete";
      default:
        return "get";
    }
  }

  public UserInfo getUser() {
    return user;
  }

  public String getVerb() {
    return verb;
  }

  public String getPath() {
    return path;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RequestAttributes)) {
      return false;
    }
    RequestAttributes other = (RequestAttributes) o;
    return user.equals(other.user) && verb.equals(other.verb) && path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(user, verb, path);
  }
}
