// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

/**
 * Endpoint and credentials which let the server call itself over its own secure listener.
 */
public class LoopbackClientConfig {

  public static final String LOOPBACK_SERVER_NAME = "apiserver-loopback-client";

  private final String host;
  private final String bearerToken;
  private final byte[] caData;

  /**
   * Creates a loopback client configuration.
   * @param host the https URL of the local secure port
   * @param bearerToken a token the server will accept as a privileged user
   * @param caData PEM bundle used to verify the serving certificate
   */
  public LoopbackClientConfig(String host, String bearerToken, byte[] caData) {
    this.host = host;
    this.bearerToken = bearerToken;
    this.caData = caData;
  }

  public String getHost() {
    return host;
  }

  public String getBearerToken() {
    return bearerToken;
  }

  public byte[] getCaData() {
    return caData;
  }

  public String getServerName() {
    return LOOPBACK_SERVER_NAME;
  }

  @Override
  public String toString() {
    return "LoopbackClientConfig{host=" + host + ", serverName=" + LOOPBACK_SERVER_NAME + "}";
  }
}
