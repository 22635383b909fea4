// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/** A PEM encoded certificate and its matching PEM encoded private key. */
public class CertKey {

  private final byte[] certificate;
  private final byte[] privateKey;

  public CertKey(byte[] certificate, byte[] privateKey) {
    this.certificate = certificate;
    this.privateKey = privateKey;
  }

  /**
   * Reads a certificate and key pair from PEM files.
   * @param certFile the certificate file
   * @param keyFile the private key file
   * @return the pair
   * @throws IOException if either file cannot be read
   */
  public static CertKey fromFiles(File certFile, File keyFile) throws IOException {
    return new CertKey(Files.readAllBytes(certFile.toPath()), Files.readAllBytes(keyFile.toPath()));
  }

  public byte[] getCertificate() {
    return certificate;
  }

  public String getCertificatePem() {
    return new String(certificate, StandardCharsets.UTF_8);
  }

  public byte[] getPrivateKey() {
    return privateKey;
  }

  public boolean isEmpty() {
    return certificate == null || certificate.length == 0 || privateKey == null || privateKey.length == 0;
  }
}
