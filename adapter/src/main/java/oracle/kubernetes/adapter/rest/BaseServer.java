// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

import io.kubernetes.client.util.SSLUtils;
import oracle.kubernetes.adapter.config.CertKey;
import oracle.kubernetes.adapter.config.SecureServingInfo;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.grizzly.http.server.NetworkListener;
import org.glassfish.grizzly.nio.transport.TCPNIOTransport;
import org.glassfish.grizzly.ssl.SSLEngineConfigurator;
import org.glassfish.grizzly.threadpool.ThreadPoolConfig;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.server.ResourceConfig;

public abstract class BaseServer {
  static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  static final int CORE_POOL_SIZE = 3;
  static final String SSL_CONTEXT_PROTOCOL = "TLS";

  /**
   * Starts the server.
   *
   * @throws IOException if the listener cannot be opened
   * @throws GeneralSecurityException if the serving certificate or client CA cannot be used
   */
  public abstract void start() throws IOException, GeneralSecurityException;

  /**
   * Stops the server. Safe to call even if start threw an exception.
   */
  public abstract void stop();

  protected abstract ResourceConfig createResourceConfig();

  protected void configureServer(HttpServer h) {
    // no-op
  }

  protected HttpServer createHttpsServer(SSLContext ssl, SecureServingInfo servingInfo) throws IOException {
    SSLEngineConfigurator engineConfigurator = new SSLEngineConfigurator(ssl)
          .setClientMode(false)
          .setWantClientAuth(servingInfo.getClientCa() != null)
          .setEnabledProtocols(servingInfo.getEnabledProtocols());
    if (!servingInfo.getCipherSuites().isEmpty()) {
      engineConfigurator.setEnabledCipherSuites(servingInfo.getCipherSuites().toArray(new String[0]));
    }

    HttpServer h =
        GrizzlyHttpServerFactory.createHttpServer(
            URI.create(servingInfo.getUri()),
            createResourceConfig(),
            true,
            engineConfigurator,
            false);
    updateHttpServer(h);

    configureServer(h);

    h.start();
    return h;
  }

  private void updateHttpServer(HttpServer h) {
    // Keep the worker and kernel pools small; they are core sizes and still grow under load.
    Collection<NetworkListener> nlc = h.getListeners();
    if (nlc != null) {
      for (NetworkListener nl : nlc) {
        TCPNIOTransport transport = nl.getTransport();
        ThreadPoolConfig t = transport.getWorkerThreadPoolConfig();
        if (t == null) {
          t = ThreadPoolConfig.defaultConfig();
          transport.setWorkerThreadPoolConfig(t);
        }
        updateThreadPoolConfig(t);

        t = transport.getKernelThreadPoolConfig();
        if (t == null) {
          t = ThreadPoolConfig.defaultConfig();
          transport.setKernelThreadPoolConfig(t);
        }
        updateThreadPoolConfig(t);
        transport.setSelectorRunnersCount(CORE_POOL_SIZE);
      }
    }
  }

  private void updateThreadPoolConfig(ThreadPoolConfig threadPoolConfig) {
    threadPoolConfig.setCorePoolSize(CORE_POOL_SIZE);
    ThreadFactory x = threadPoolConfig.getThreadFactory();
    ThreadFactory tf = x != null ? x : Executors.defaultThreadFactory();
    threadPoolConfig.setThreadFactory(
        r -> {
          Thread n = tf.newThread(r);
          if (!n.isDaemon()) {
            n.setDaemon(true);
          }
          return n;
        });
  }

  protected SSLContext createSslContext(KeyManager[] kms, TrustManager[] tms) throws GeneralSecurityException {
    SSLContext ssl = SSLContext.getInstance(SSL_CONTEXT_PROTOCOL);
    ssl.init(kms, tms, new SecureRandom());
    return ssl;
  }

  protected KeyManager[] createKeyManagers(CertKey certKey) throws IOException, GeneralSecurityException {
    LOGGER.entering();
    KeyManager[] result =
        SSLUtils.keyManagers(
            certKey.getCertificate(),
            certKey.getPrivateKey(),
            "", // Let utility figure out the key algorithm
            "", // key passphrase in the temp keystore that gets created to hold the keypair
            null, // file name of the temp keystore
            null // pass phrase of the temp keystore
            );
    LOGGER.exiting(result);
    return result;
  }

  /**
   * Creates trust managers which accept client certificates signed by any CA in a PEM bundle.
   * @param caBundle the PEM bundle, or null to use the JDK defaults
   * @return the trust managers, or null for the JDK defaults
   * @throws IOException if the keystore cannot be initialized
   * @throws GeneralSecurityException if the bundle cannot be parsed
   */
  protected TrustManager[] createTrustManagers(byte[] caBundle) throws IOException, GeneralSecurityException {
    if (caBundle == null) {
      return null;
    }
    KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
    trustStore.load(null, null);
    int index = 0;
    for (Certificate certificate : CertificateFactory.getInstance("X.509")
          .generateCertificates(new ByteArrayInputStream(caBundle))) {
      trustStore.setCertificateEntry("client-ca-" + index++, certificate);
    }
    TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
    factory.init(trustStore);
    return factory.getTrustManagers();
  }
}
