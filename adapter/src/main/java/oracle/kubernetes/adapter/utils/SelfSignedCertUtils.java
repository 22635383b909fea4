// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.utils;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.security.spec.RSAKeyGenParameterSpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import javax.annotation.Nonnull;

import oracle.kubernetes.adapter.config.CertKey;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.RFC4519Style;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.generators.RSAKeyPairGenerator;
import org.bouncycastle.crypto.params.RSAKeyGenerationParameters;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.params.RSAPrivateCrtKeyParameters;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * Utility class for generating key-pairs and self-signed serving certificates.
 */
public final class SelfSignedCertUtils {

  public static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
  public static final int CERTIFICATE_VALIDITY_DAYS = 365;

  private SelfSignedCertUtils() {
    // no-op
  }

  /**
   * Generates a self-signed serving certificate and its private key, both PEM encoded. The
   * certificate names the host, plus any alternate addresses, as subject alternative names.
   *
   * @param host a DNS name or IP address
   * @param alternateIps additional IP addresses the certificate is valid for
   * @param alternateDns additional DNS names the certificate is valid for
   * @return the certificate and key pair
   * @throws GeneralSecurityException if the key or certificate cannot be created
   */
  public static CertKey generateSelfSignedCertKey(String host, List<String> alternateIps, List<String> alternateDns)
        throws GeneralSecurityException {
    try {
      KeyPair keyPair = createKeyPair();
      X509Certificate certificate = generateCertificate(keyPair, SIGNATURE_ALGORITHM,
            host + "@" + Instant.now().getEpochSecond(), CERTIFICATE_VALIDITY_DAYS,
            getSubjectAlternativeNames(host, alternateIps, alternateDns));
      return new CertKey(toPemBytes(certificate), toPemBytes(keyPair.getPrivate()));
    } catch (OperatorCreationException | IOException e) {
      throw new GeneralSecurityException(e);
    }
  }

  /**
   * Generates an RSA key pair using the BouncyCastle lib.
   *
   * @return Key pair
   * @throws GeneralSecurityException if the JDK cannot represent the generated key
   */
  public static KeyPair createKeyPair() throws GeneralSecurityException {
    RSAKeyPairGenerator rsaKeyPairGenerator = new RSAKeyPairGenerator();
    rsaKeyPairGenerator.init(new RSAKeyGenerationParameters(RSAKeyGenParameterSpec.F4, new SecureRandom(), 2048, 80));
    AsymmetricCipherKeyPair keypair = rsaKeyPairGenerator.generateKeyPair();

    RSAKeyParameters publicKey = (RSAKeyParameters) keypair.getPublic();
    RSAPrivateCrtKeyParameters privateKey = (RSAPrivateCrtKeyParameters) keypair.getPrivate();

    KeyFactory keyFactory = KeyFactory.getInstance("RSA");
    PublicKey pubKey = keyFactory.generatePublic(
          new RSAPublicKeySpec(publicKey.getModulus(), publicKey.getExponent()));
    PrivateKey privKey = keyFactory.generatePrivate(
          new RSAPrivateCrtKeySpec(publicKey.getModulus(), publicKey.getExponent(),
                privateKey.getExponent(), privateKey.getP(), privateKey.getQ(),
                privateKey.getDP(), privateKey.getDQ(), privateKey.getQInv()));

    return new KeyPair(pubKey, privKey);
  }

  /**
   * Generates a self-signed certificate using the BouncyCastle lib. The certificate may also act as
   * its own CA, so that a client can trust it directly.
   *
   * @param keyPair used for signing the certificate with its private key
   * @param hashAlgorithm signature algorithm
   * @param commonName Common Name to be used in the subject dn
   * @param certificateValidityDays validity period in days of the certificate
   * @param subjectAlternativeNames the names the certificate is valid for
   * @return self-signed X509Certificate
   * @throws OperatorCreationException on creating the content signer
   * @throws IOException on adding an extension
   * @throws GeneralSecurityException on getting the certificate from the provider
   */
  public static X509Certificate generateCertificate(KeyPair keyPair, String hashAlgorithm, String commonName,
                                                    int certificateValidityDays, GeneralNames subjectAlternativeNames)
        throws OperatorCreationException, IOException, GeneralSecurityException {
    Instant now = Instant.now();
    Date notBefore = Date.from(now.minus(Duration.ofHours(1)));
    Date notAfter = Date.from(now.plus(Duration.ofDays(certificateValidityDays)));

    ContentSigner contentSigner = new JcaContentSignerBuilder(hashAlgorithm).build(keyPair.getPrivate());
    X500Name x500Name = createX500NameBuilder(commonName).build();
    X509v3CertificateBuilder certificateBuilder =
          new JcaX509v3CertificateBuilder(x500Name,
                BigInteger.valueOf(now.toEpochMilli()),
                notBefore,
                notAfter,
                x500Name,
                keyPair.getPublic())
                .addExtension(Extension.basicConstraints, true, new BasicConstraints(true))
                .addExtension(Extension.keyUsage, true,
                      new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment | KeyUsage.keyCertSign))
                .addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_serverAuth))
                .addExtension(Extension.subjectAlternativeName, false, subjectAlternativeNames);

    return new JcaX509CertificateConverter()
          .setProvider(new BouncyCastleProvider()).getCertificate(certificateBuilder.build(contentSigner));
  }

  @Nonnull
  static GeneralNames getSubjectAlternativeNames(String host, List<String> alternateIps, List<String> alternateDns) {
    List<GeneralName> names = new ArrayList<>();
    names.add(toGeneralName(host));
    alternateIps.stream().map(ip -> new GeneralName(GeneralName.iPAddress, ip)).forEach(names::add);
    alternateDns.stream().map(dns -> new GeneralName(GeneralName.dNSName, dns)).forEach(names::add);
    return new GeneralNames(names.toArray(new GeneralName[0]));
  }

  private static GeneralName toGeneralName(String host) {
    return isIpAddress(host)
          ? new GeneralName(GeneralName.iPAddress, host)
          : new GeneralName(GeneralName.dNSName, host);
  }

  private static boolean isIpAddress(String host) {
    return host.matches("\\d{1,3}(\\.\\d{1,3}){3}") || host.contains(":");
  }

  private static X500NameBuilder createX500NameBuilder(String commonName) {
    X500NameBuilder builder = new X500NameBuilder(RFC4519Style.INSTANCE);
    builder.addRDN(RFC4519Style.cn, commonName);
    return builder;
  }

  /**
   * Converts a certificate or key to PEM format.
   * @param object the object to convert
   * @return the PEM text, as UTF-8 bytes
   * @throws IOException if the object cannot be encoded
   */
  public static byte[] toPemBytes(Object object) throws IOException {
    StringWriter writer = new StringWriter();
    try (JcaPEMWriter pemWriter = new JcaPEMWriter(writer)) {
      pemWriter.writeObject(object);
    }
    return writer.toString().getBytes(StandardCharsets.UTF_8);
  }
}
