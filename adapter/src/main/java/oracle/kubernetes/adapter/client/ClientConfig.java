// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.client;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The endpoint and credentials used to reach the Kubernetes API server. Instances are immutable;
 * use {@link #builder()} to create one.
 */
public class ClientConfig {

  private final String host;
  private final String bearerToken;
  private final String username;
  private final String password;
  private final byte[] caData;
  private final byte[] certData;
  private final byte[] keyData;
  private final boolean insecure;
  private final Duration timeout;

  private ClientConfig(Builder builder) {
    this.host = builder.host;
    this.bearerToken = builder.bearerToken;
    this.username = builder.username;
    this.password = builder.password;
    this.caData = builder.caData;
    this.certData = builder.certData;
    this.keyData = builder.keyData;
    this.insecure = builder.insecure;
    this.timeout = builder.timeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getHost() {
    return host;
  }

  @Nullable
  public String getBearerToken() {
    return bearerToken;
  }

  @Nullable
  public String getUsername() {
    return username;
  }

  @Nullable
  public String getPassword() {
    return password;
  }

  @Nullable
  public byte[] getCaData() {
    return caData;
  }

  @Nullable
  public byte[] getCertData() {
    return certData;
  }

  @Nullable
  public byte[] getKeyData() {
    return keyData;
  }

  public boolean isInsecure() {
    return insecure;
  }

  public Optional<Duration> getTimeout() {
    return Optional.ofNullable(timeout);
  }

  // credentials are deliberately left out
  @Override
  public String toString() {
    return "ClientConfig{host=" + host + ", insecure=" + insecure + "}";
  }

  public static class Builder {
    private String host;
    private String bearerToken;
    private String username;
    private String password;
    private byte[] caData;
    private byte[] certData;
    private byte[] keyData;
    private boolean insecure;
    private Duration timeout;

    private Builder() {
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder bearerToken(String bearerToken) {
      this.bearerToken = bearerToken;
      return this;
    }

    /**
     * Sets basic authentication credentials.
     * @param username the user name
     * @param password the password
     * @return this builder
     */
    public Builder basicAuth(String username, String password) {
      this.username = username;
      this.password = password;
      return this;
    }

    public Builder caData(byte[] caData) {
      this.caData = caData;
      return this;
    }

    /**
     * Sets a client certificate and its private key, both PEM encoded.
     * @param certData the certificate
     * @param keyData the private key
     * @return this builder
     */
    public Builder clientCertificate(byte[] certData, byte[] keyData) {
      this.certData = certData;
      this.keyData = keyData;
      return this;
    }

    public Builder insecure(boolean insecure) {
      this.insecure = insecure;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public ClientConfig build() {
      return new ClientConfig(this);
    }
  }
}
