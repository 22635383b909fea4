// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.io.File;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import oracle.kubernetes.adapter.config.CertKey;
import oracle.kubernetes.adapter.config.SecureServingInfo;
import oracle.kubernetes.adapter.utils.SelfSignedCertUtils;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;
import org.apache.commons.io.FileUtils;

/** Options for the HTTPS listener: where it binds and which certificate it presents. */
public class SecureServingOptions implements OptionSet {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
  static final int DEFAULT_PORT = 443;
  static final String DEFAULT_PAIR_NAME = "apiserver";
  static final String DEFAULT_TLS_VERSION = "TLSv1.2";

  private static final Map<String, String> TLS_VERSIONS = Map.of(
        "VersionTLS10", "TLSv1",
        "VersionTLS11", "TLSv1.1",
        "VersionTLS12", "TLSv1.2",
        "VersionTLS13", "TLSv1.3");

  private String bindAddress = DEFAULT_BIND_ADDRESS;
  private int bindPort = DEFAULT_PORT;
  private String certDirectory = "";
  private String pairName = DEFAULT_PAIR_NAME;
  private String certFile = "";
  private String keyFile = "";
  private String minTlsVersion = "";
  private List<String> cipherSuites = new ArrayList<>();
  private CertKey generatedCert;

  public String getBindAddress() {
    return bindAddress;
  }

  public void setBindAddress(String bindAddress) {
    this.bindAddress = bindAddress;
  }

  public int getBindPort() {
    return bindPort;
  }

  public void setBindPort(int bindPort) {
    this.bindPort = bindPort;
  }

  public String getCertDirectory() {
    return certDirectory;
  }

  public void setCertDirectory(String certDirectory) {
    this.certDirectory = certDirectory;
  }

  public String getPairName() {
    return pairName;
  }

  public void setPairName(String pairName) {
    this.pairName = pairName;
  }

  public String getCertFile() {
    return certFile;
  }

  public void setCertFile(String certFile) {
    this.certFile = certFile;
  }

  public String getKeyFile() {
    return keyFile;
  }

  public void setKeyFile(String keyFile) {
    this.keyFile = keyFile;
  }

  public String getMinTlsVersion() {
    return minTlsVersion;
  }

  public void setMinTlsVersion(String minTlsVersion) {
    this.minTlsVersion = minTlsVersion;
  }

  public List<String> getCipherSuites() {
    return cipherSuites;
  }

  public void setCipherSuites(List<String> cipherSuites) {
    this.cipherSuites = new ArrayList<>(cipherSuites);
  }

  /**
   * Returns the certificate generated by {@link #maybeDefaultWithSelfSignedCerts}, if it was kept in memory.
   */
  public CertKey getGeneratedCert() {
    return generatedCert;
  }

  @Override
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (bindPort < 1 || bindPort > 65535) {
      errors.add(String.format(
            "--secure-port %d must be between 1 and 65535, inclusive. It cannot be turned off with 0", bindPort));
    }
    if (!isIpAddress(bindAddress)) {
      errors.add(String.format("--bind-address %s is not a valid IP address", bindAddress));
    }
    if (certFile.isEmpty() != keyFile.isEmpty()) {
      errors.add("--tls-cert-file and --tls-private-key-file must both be specified or both be empty");
    }
    if (!minTlsVersion.isEmpty() && !TLS_VERSIONS.containsKey(minTlsVersion)) {
      errors.add(String.format("--tls-min-version: unknown TLS version %s, must be one of "
            + "VersionTLS10, VersionTLS11, VersionTLS12, VersionTLS13", minTlsVersion));
    }
    if ("VersionTLS13".equals(minTlsVersion) && !cipherSuites.isEmpty()) {
      errors.add("--tls-cipher-suites cannot be set when --tls-min-version is VersionTLS13; "
            + "TLS 1.3 cipher suites are not configurable");
    }
    return errors;
  }

  static boolean isIpAddress(String address) {
    return address != null
          && (address.matches("\\d{1,3}(\\.\\d{1,3}){3}") || address.matches("[0-9a-fA-F:.]*:[0-9a-fA-F:.]*"));
  }

  @Override
  public void addFlags(FlagSet flags) {
    flags.addStringFlag("bind-address", DEFAULT_BIND_ADDRESS,
          "The IP address on which to listen for the --secure-port port. 0.0.0.0 listens on all interfaces.",
          this::setBindAddress);
    flags.addIntFlag("secure-port", DEFAULT_PORT,
          "The port on which to serve HTTPS with authentication and authorization.", this::setBindPort);
    flags.addStringFlag("cert-dir", "",
          "The directory where the TLS certs are located. "
                + "If --tls-cert-file and --tls-private-key-file are provided, this flag will be ignored.",
          this::setCertDirectory);
    flags.addStringFlag("tls-cert-file", "",
          "File containing the default x509 certificate for HTTPS. If HTTPS serving is enabled, and "
                + "--tls-cert-file and --tls-private-key-file are not provided, a self-signed certificate "
                + "and key are generated for the public address and saved to the directory specified by --cert-dir.",
          this::setCertFile);
    flags.addStringFlag("tls-private-key-file", "",
          "File containing the default x509 private key matching --tls-cert-file.", this::setKeyFile);
    flags.addStringFlag("tls-min-version", "",
          "Minimum TLS version supported. Possible values: VersionTLS10, VersionTLS11, VersionTLS12, VersionTLS13",
          this::setMinTlsVersion);
    flags.addStringListFlag("tls-cipher-suites", List.of(),
          "Comma-separated list of cipher suites for the server. "
                + "If omitted, the default JDK cipher suites will be used.",
          this::setCipherSuites);
  }

  /**
   * Generates a self-signed serving certificate unless one has been configured. A certificate and
   * key already present in the cert directory are reused; otherwise a generated pair is written
   * there, or kept in memory when no cert directory is set.
   * @param publicAddress the host name or IP address the certificate is issued for
   * @param alternateDns additional DNS names
   * @param alternateIps additional IP addresses
   * @throws ConfigurationException if the certificate cannot be created or stored
   */
  public void maybeDefaultWithSelfSignedCerts(String publicAddress, List<String> alternateDns,
                                              List<String> alternateIps) throws ConfigurationException {
    if (!certFile.isEmpty() || !keyFile.isEmpty()) {
      return;
    }

    File generatedCertFile = null;
    File generatedKeyFile = null;
    if (!certDirectory.isEmpty()) {
      if (pairName.isEmpty()) {
        throw new ConfigurationException("PairName is required if CertDirectory is set");
      }
      generatedCertFile = new File(certDirectory, pairName + ".crt");
      generatedKeyFile = new File(certDirectory, pairName + ".key");
      if (canReadCertAndKey(generatedCertFile, generatedKeyFile)) {
        certFile = generatedCertFile.getPath();
        keyFile = generatedKeyFile.getPath();
        LOGGER.info(MessageKeys.USING_EXISTING_CERT, certFile, keyFile);
        return;
      }
    }

    List<String> dnsNames = new ArrayList<>(alternateDns);
    List<String> ipAddresses = new ArrayList<>(alternateIps);
    if (isUnspecified(bindAddress)) {
      dnsNames.add("localhost");
    } else {
      ipAddresses.add(bindAddress);
    }

    CertKey certKey = generate(publicAddress, ipAddresses, dnsNames);
    if (generatedCertFile != null) {
      writeCertKey(certKey, generatedCertFile, generatedKeyFile);
      certFile = generatedCertFile.getPath();
      keyFile = generatedKeyFile.getPath();
      LOGGER.info(MessageKeys.GENERATED_SELF_SIGNED_CERT, publicAddress, certFile + ", " + keyFile);
    } else {
      generatedCert = certKey;
      LOGGER.info(MessageKeys.GENERATED_SELF_SIGNED_CERT, publicAddress, "memory");
    }
  }

  private CertKey generate(String publicAddress, List<String> ipAddresses, List<String> dnsNames)
        throws ConfigurationException {
    try {
      return SelfSignedCertUtils.generateSelfSignedCertKey(publicAddress, ipAddresses, dnsNames);
    } catch (GeneralSecurityException e) {
      throw new ConfigurationException("unable to generate self signed cert: " + e.getMessage(), e);
    }
  }

  private void writeCertKey(CertKey certKey, File certOut, File keyOut) throws ConfigurationException {
    try {
      FileUtils.writeByteArrayToFile(certOut, certKey.getCertificate());
      FileUtils.writeByteArrayToFile(keyOut, certKey.getPrivateKey());
    } catch (IOException e) {
      throw new ConfigurationException(
            "unable to write self signed cert to " + certDirectory + ": " + e.getMessage(), e);
    }
  }

  private boolean canReadCertAndKey(File cert, File key) throws ConfigurationException {
    boolean certReadable = cert.canRead();
    boolean keyReadable = key.canRead();
    if (certReadable != keyReadable) {
      throw new ConfigurationException(String.format("exactly one of %s or %s exists", cert, key));
    }
    return certReadable;
  }

  static boolean isUnspecified(String address) {
    return address == null || address.isEmpty() || address.equals("0.0.0.0") || address.equals("::");
  }

  /**
   * Builds the listener settings.
   * @param servingTarget receives the settings
   * @throws ConfigurationException if the serving certificate cannot be loaded
   */
  public void applyTo(Consumer<SecureServingInfo> servingTarget) throws ConfigurationException {
    servingTarget.accept(createServingInfo());
  }

  SecureServingInfo createServingInfo() throws ConfigurationException {
    return new SecureServingInfo(bindAddress, bindPort, loadCertKey(),
          minTlsVersion.isEmpty() ? DEFAULT_TLS_VERSION : TLS_VERSIONS.get(minTlsVersion), cipherSuites);
  }

  private CertKey loadCertKey() throws ConfigurationException {
    if (!certFile.isEmpty() && !keyFile.isEmpty()) {
      try {
        return CertKey.fromFiles(new File(certFile), new File(keyFile));
      } catch (IOException e) {
        throw new ConfigurationException(String.format(
              "failed to load serving certificate from %s and %s: %s", certFile, keyFile, e.getMessage()), e);
      }
    } else if (generatedCert != null) {
      return generatedCert;
    }
    throw new ConfigurationException("no serving certificate: set --tls-cert-file and --tls-private-key-file");
  }
}
