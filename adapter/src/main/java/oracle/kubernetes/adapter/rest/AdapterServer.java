// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.HashMap;
import java.util.Map;

import oracle.kubernetes.adapter.audit.AuditBackend;
import oracle.kubernetes.adapter.config.FlowControl;
import oracle.kubernetes.adapter.config.SecureServingInfo;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.features.FeatureGates;
import oracle.kubernetes.adapter.rest.resource.HealthResource;
import oracle.kubernetes.adapter.rest.resource.MetricsResource;
import oracle.kubernetes.adapter.rest.resource.OpenApiResource;
import oracle.kubernetes.adapter.rest.resource.ProfilingResource;
import oracle.kubernetes.common.logging.MessageKeys;
import org.glassfish.grizzly.http.CompressionConfig;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.grizzly.http.server.NetworkListener;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.server.ResourceConfig;

/**
 * The HTTPS server of the custom metrics adapter, built from an applied {@link ServerConfig}.
 * Every request passes flow control, authentication and authorization; completed requests are
 * audited and counted.
 */
public class AdapterServer extends BaseServer {

  public static final String SERVER_CONFIG_PROPERTY = "ServerConfig";
  public static final String REQUEST_METRICS_PROPERTY = "RequestMetrics";

  private final ServerConfig config;
  private final RequestMetrics metrics = new RequestMetrics();
  private HttpServer httpsServer;

  public AdapterServer(ServerConfig config) {
    this.config = config;
  }

  public RequestMetrics getMetrics() {
    return metrics;
  }

  /**
   * Returns the port the server is listening on, or -1 if it is not running.
   */
  public int getPort() {
    if (httpsServer == null) {
      return -1;
    }
    return httpsServer.getListeners().stream().findFirst().map(NetworkListener::getPort).orElse(-1);
  }

  @Override
  public void start() throws IOException, GeneralSecurityException {
    LOGGER.entering();
    if (httpsServer != null) {
      throw new AssertionError("Already started");
    }
    SecureServingInfo servingInfo = config.getSecureServing();
    if (servingInfo == null) {
      throw new IllegalStateException("secure serving has not been configured");
    }

    boolean fullyStarted = false;
    try {
      httpsServer = createHttpsServer(
            createSslContext(createKeyManagers(servingInfo.getCertKey()),
                  createTrustManagers(servingInfo.getClientCa())),
            servingInfo);
      if (config.getFlowControl() != null) {
        config.getFlowControl().start();
      }
      LOGGER.info(MessageKeys.SERVER_STARTED, servingInfo.getUri());
      fullyStarted = true;
    } finally {
      if (!fullyStarted) {
        stop();
      }
    }
    LOGGER.exiting();
  }

  @Override
  public void stop() {
    LOGGER.entering();
    if (httpsServer != null) {
      httpsServer.shutdownNow();
      httpsServer = null;
      LOGGER.info(MessageKeys.SERVER_STOPPED);
    }
    FlowControl flowControl = config.getFlowControl();
    if (flowControl != null) {
      flowControl.stop();
    }
    closeAuditBackend();
    LOGGER.exiting();
  }

  private void closeAuditBackend() {
    AuditBackend backend = config.getAuditBackend();
    if (backend != null) {
      try {
        backend.close();
      } catch (IOException e) {
        LOGGER.warning(MessageKeys.AUDIT_WRITE_FAILED, e);
      }
    }
  }

  @Override
  protected void configureServer(HttpServer h) {
    FeatureGates gates = config.getFeatureGates();
    if (gates != null && gates.isFeatureEnabled(FeatureGates.API_RESPONSE_COMPRESSION)) {
      for (NetworkListener nl : h.getListeners()) {
        nl.getCompressionConfig().setCompressionMode(CompressionConfig.CompressionMode.ON);
      }
    }
  }

  @Override
  protected ResourceConfig createResourceConfig() {
    LOGGER.entering();
    ResourceConfig rc =
        new ResourceConfig()
            .register(JacksonFeature.class)
            .register(FlowControlFilter.class)
            .register(AuditFilter.class)
            .register(SecurityFilter.class)
            .register(HealthResource.class)
            .register(OpenApiResource.class);
    if (config.isEnableMetrics()) {
      rc.register(MetricsFilter.class).register(MetricsResource.class);
    }
    if (config.isEnableProfiling()) {
      rc.register(ProfilingResource.class);
    }

    // attach the configuration so that filters and resources can find it
    Map<String, Object> extraProps = new HashMap<>();
    extraProps.put(SERVER_CONFIG_PROPERTY, config);
    extraProps.put(REQUEST_METRICS_PROPERTY, metrics);
    rc.addProperties(extraProps);

    LOGGER.exiting();
    return rc;
  }
}
