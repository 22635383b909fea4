// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

import io.kubernetes.client.openapi.ApiClient;
import oracle.kubernetes.adapter.client.ApiClientFactory;
import oracle.kubernetes.adapter.client.ClientConfig;
import oracle.kubernetes.adapter.client.ClientConstructionException;
import oracle.kubernetes.adapter.client.DefaultApiClientFactory;
import oracle.kubernetes.adapter.client.VersionedInformers;
import oracle.kubernetes.adapter.config.OpenApiConfig;
import oracle.kubernetes.adapter.config.OpenApiV3Config;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;

/**
 * The options of the custom metrics adapter server. Each concern is configured by its own option
 * set; this class validates them together and applies them, in dependency order, to a server
 * configuration.
 */
public class ServerOptions implements OptionSet {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  static final Duration INFORMER_RESYNC_PERIOD = Duration.ofMinutes(10);
  static final String SELF_SIGNED_HOST = "localhost";
  static final List<String> SELF_SIGNED_IPS = List.of("127.0.0.1");

  @SuppressWarnings("FieldMayBeFinal") // stubbed in unit tests
  private static ApiClientFactory clientFactory = new DefaultApiClientFactory();

  private final SecureServingOptionsWithLoopback secureServing = new SecureServingOptionsWithLoopback();
  private final DelegatingAuthenticationOptions authentication = new DelegatingAuthenticationOptions();
  private final DelegatingAuthorizationOptions authorization = new DelegatingAuthorizationOptions();
  private final AuditOptions audit = new AuditOptions();
  private final FeatureOptions features = new FeatureOptions();

  private OpenApiConfig openApiConfig;
  private OpenApiV3Config openApiV3Config;
  private boolean enableMetrics = true;

  public SecureServingOptionsWithLoopback getSecureServing() {
    return secureServing;
  }

  public DelegatingAuthenticationOptions getAuthentication() {
    return authentication;
  }

  public DelegatingAuthorizationOptions getAuthorization() {
    return authorization;
  }

  public AuditOptions getAudit() {
    return audit;
  }

  public FeatureOptions getFeatures() {
    return features;
  }

  @Nullable
  public OpenApiConfig getOpenApiConfig() {
    return openApiConfig;
  }

  public void setOpenApiConfig(OpenApiConfig openApiConfig) {
    this.openApiConfig = openApiConfig;
  }

  @Nullable
  public OpenApiV3Config getOpenApiV3Config() {
    return openApiV3Config;
  }

  public void setOpenApiV3Config(OpenApiV3Config openApiV3Config) {
    this.openApiV3Config = openApiV3Config;
  }

  public boolean isEnableMetrics() {
    return enableMetrics;
  }

  public void setEnableMetrics(boolean enableMetrics) {
    this.enableMetrics = enableMetrics;
  }

  private List<OptionSet> getOptionSets() {
    return List.of(secureServing, authentication, authorization, audit, features);
  }

  @Override
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    getOptionSets().forEach(o -> errors.addAll(o.validate()));
    return errors;
  }

  @Override
  public void addFlags(FlagSet flags) {
    getOptionSets().forEach(o -> o.addFlags(flags));
  }

  /**
   * Applies the options to a server configuration. Steps run in the order of {@link ApplyStep};
   * the first failure stops the sequence, leaving the changes of the earlier steps in place.
   *
   * @param serverConfig the configuration to update
   * @param clientConfig the endpoint and credentials of the Kubernetes API server the adapter reads from
   * @throws ApplyException naming the step that failed
   */
  public void applyTo(ServerConfig serverConfig, ClientConfig clientConfig) throws ApplyException {
    LOGGER.entering();
    runStep(ApplyStep.CERTIFICATE_GENERATION, () -> secureServing.maybeDefaultWithSelfSignedCerts(
          SELF_SIGNED_HOST, Collections.emptyList(), SELF_SIGNED_IPS));
    runStep(ApplyStep.SECURE_SERVING,
          () -> secureServing.applyTo(serverConfig::setSecureServing, serverConfig::setLoopbackClientConfig));
    runStep(ApplyStep.AUTHENTICATION,
          () -> authentication.applyTo(serverConfig.getAuthentication(), serverConfig.getSecureServing(), null));
    runStep(ApplyStep.AUTHORIZATION, () -> authorization.applyTo(serverConfig.getAuthorization()));
    runStep(ApplyStep.AUDIT, () -> audit.applyTo(serverConfig));

    LOGGER.info(MessageKeys.EXTERNAL_CLIENT_CONFIG, clientConfig.getHost());
    ApiClient client = createClient(clientConfig);
    VersionedInformers informers = createInformers(client);
    runStep(ApplyStep.FEATURES, () -> features.applyTo(serverConfig, client, informers));

    if (openApiConfig != null) {
      serverConfig.setOpenApiConfig(openApiConfig);
    }
    if (openApiV3Config != null) {
      serverConfig.setOpenApiV3Config(openApiV3Config);
    }

    serverConfig.setEnableMetrics(enableMetrics);
    LOGGER.exiting();
  }

  private ApiClient createClient(ClientConfig clientConfig) throws ApplyException {
    try {
      return clientFactory.createClient(clientConfig);
    } catch (ClientConstructionException | RuntimeException e) {
      throw new ApplyException(ApplyStep.CLIENT_CONSTRUCTION, e);
    }
  }

  private VersionedInformers createInformers(ApiClient client) throws ApplyException {
    try {
      return clientFactory.createInformers(client, INFORMER_RESYNC_PERIOD);
    } catch (ClientConstructionException | RuntimeException e) {
      throw new ApplyException(ApplyStep.CLIENT_CONSTRUCTION, e);
    }
  }

  private void runStep(ApplyStep step, ConfigurationAction action) throws ApplyException {
    try {
      action.run();
    } catch (ConfigurationException e) {
      throw new ApplyException(step, e);
    }
  }

  @FunctionalInterface
  private interface ConfigurationAction {
    void run() throws ConfigurationException;
  }
}
