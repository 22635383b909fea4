// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import java.util.Collections;
import java.util.List;

import oracle.kubernetes.adapter.security.Authenticator;

/** How the server authenticates inbound requests. */
public class AuthenticationInfo {

  private Authenticator authenticator;
  private List<String> apiAudiences = Collections.emptyList();
  private byte[] clientCa;

  public Authenticator getAuthenticator() {
    return authenticator;
  }

  public void setAuthenticator(Authenticator authenticator) {
    this.authenticator = authenticator;
  }

  public List<String> getApiAudiences() {
    return apiAudiences;
  }

  public void setApiAudiences(List<String> apiAudiences) {
    this.apiAudiences = apiAudiences;
  }

  public byte[] getClientCa() {
    return clientCa;
  }

  public void setClientCa(byte[] clientCa) {
    this.clientCa = clientCa;
  }
}
