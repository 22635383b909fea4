// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/** The listener and TLS settings the server engine uses to open its secure port. */
public class SecureServingInfo {

  private static final List<String> PROTOCOLS_BY_VERSION = List.of("TLSv1", "TLSv1.1", "TLSv1.2", "TLSv1.3");

  private final String bindAddress;
  private final int port;
  private final CertKey certKey;
  private final String minTlsVersion;
  private final List<String> cipherSuites;
  private byte[] clientCa;

  /**
   * Creates the serving info.
   * @param bindAddress the address to listen on
   * @param port the secure port
   * @param certKey the serving certificate and key
   * @param minTlsVersion the lowest JSSE protocol name to accept, e.g. TLSv1.2
   * @param cipherSuites the JSSE cipher suite names to enable. Empty for the JDK defaults.
   */
  public SecureServingInfo(String bindAddress, int port, CertKey certKey, String minTlsVersion,
                           List<String> cipherSuites) {
    this.bindAddress = bindAddress;
    this.port = port;
    this.certKey = certKey;
    this.minTlsVersion = minTlsVersion;
    this.cipherSuites = Collections.unmodifiableList(new ArrayList<>(cipherSuites));
  }

  public String getBindAddress() {
    return bindAddress;
  }

  public int getPort() {
    return port;
  }

  public String getUri() {
    return "https://" + bindAddress + ":" + port;
  }

  public CertKey getCertKey() {
    return certKey;
  }

  public String getMinTlsVersion() {
    return minTlsVersion;
  }

  public List<String> getCipherSuites() {
    return cipherSuites;
  }

  /**
   * Returns the protocols the listener enables: the minimum TLS version and every later one.
   */
  public String[] getEnabledProtocols() {
    int first = Math.max(0, PROTOCOLS_BY_VERSION.indexOf(minTlsVersion));
    return PROTOCOLS_BY_VERSION.subList(first, PROTOCOLS_BY_VERSION.size()).toArray(new String[0]);
  }

  /**
   * Returns the PEM bundle of CAs used to verify client certificates, or null if client
   * certificates are not requested.
   */
  @Nullable
  public byte[] getClientCa() {
    return clientCa;
  }

  /**
   * Asks the listener to request client certificates signed by the specified CA bundle.
   * @param clientCa a PEM bundle
   */
  public void applyClientCert(byte[] clientCa) {
    this.clientCa = clientCa;
  }
}
