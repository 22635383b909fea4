// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.Nullable;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import oracle.kubernetes.adapter.client.ClientConstructionException;
import oracle.kubernetes.adapter.client.DelegatedClients;
import oracle.kubernetes.adapter.config.AuthenticationInfo;
import oracle.kubernetes.adapter.config.SecureServingInfo;
import oracle.kubernetes.adapter.security.Authenticator;
import oracle.kubernetes.adapter.security.TokenReviewAuthenticator;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;
import org.apache.commons.io.FileUtils;

/**
 * Options for authenticating requests by delegating to the core Kubernetes API server. Bearer
 * tokens are checked with TokenReviews; client certificates are checked against a CA bundle read
 * from a file or, failing that, from the cluster's extension-apiserver-authentication config map.
 */
public class DelegatingAuthenticationOptions implements OptionSet {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(10);
  static final String AUTHENTICATION_CONFIG_MAP_NAME = "extension-apiserver-authentication";
  static final String AUTHENTICATION_CONFIG_MAP_NAMESPACE = "kube-system";
  static final String CLIENT_CA_KEY = "client-ca-file";

  private String remoteKubeConfigFile = "";
  private boolean remoteKubeConfigFileOptional;
  private Duration cacheTtl = DEFAULT_CACHE_TTL;
  private String clientCaFile = "";
  private boolean skipInClusterLookup;
  private boolean tolerateInClusterLookupFailure;

  @SuppressWarnings("FieldMayBeFinal") // stubbed in unit tests
  private static ClientCaLookup clientCaLookup = DelegatingAuthenticationOptions::readClientCaFromCluster;

  public String getRemoteKubeConfigFile() {
    return remoteKubeConfigFile;
  }

  public void setRemoteKubeConfigFile(String remoteKubeConfigFile) {
    this.remoteKubeConfigFile = remoteKubeConfigFile;
  }

  public boolean isRemoteKubeConfigFileOptional() {
    return remoteKubeConfigFileOptional;
  }

  /**
   * Allows the server to run without a delegated client. Token authentication is then disabled
   * and only anonymous requests are accepted.
   * @param remoteKubeConfigFileOptional true to tolerate a missing client
   */
  public void setRemoteKubeConfigFileOptional(boolean remoteKubeConfigFileOptional) {
    this.remoteKubeConfigFileOptional = remoteKubeConfigFileOptional;
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public void setCacheTtl(Duration cacheTtl) {
    this.cacheTtl = cacheTtl;
  }

  public String getClientCaFile() {
    return clientCaFile;
  }

  public void setClientCaFile(String clientCaFile) {
    this.clientCaFile = clientCaFile;
  }

  public boolean isSkipInClusterLookup() {
    return skipInClusterLookup;
  }

  public void setSkipInClusterLookup(boolean skipInClusterLookup) {
    this.skipInClusterLookup = skipInClusterLookup;
  }

  public boolean isTolerateInClusterLookupFailure() {
    return tolerateInClusterLookupFailure;
  }

  public void setTolerateInClusterLookupFailure(boolean tolerateInClusterLookupFailure) {
    this.tolerateInClusterLookupFailure = tolerateInClusterLookupFailure;
  }

  @Override
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (cacheTtl.isNegative()) {
      errors.add("--authentication-token-webhook-cache-ttl must not be negative");
    }
    if (!clientCaFile.isEmpty() && clientCaFile.isBlank()) {
      errors.add("--client-ca-file must not be blank");
    }
    return errors;
  }

  @Override
  public void addFlags(FlagSet flags) {
    flags.addStringFlag("authentication-kubeconfig", "",
          "kubeconfig file pointing at the 'core' kubernetes server with enough rights to create "
                + "tokenreviews.authentication.k8s.io.", this::setRemoteKubeConfigFile);
    flags.addBooleanFlag("authentication-skip-lookup", false,
          "If false, the authentication-kubeconfig will be used to lookup missing authentication "
                + "configuration from the cluster.", this::setSkipInClusterLookup);
    flags.addDurationFlag("authentication-token-webhook-cache-ttl", DEFAULT_CACHE_TTL,
          "The duration to cache responses from the webhook token authenticator.", this::setCacheTtl);
    flags.addBooleanFlag("authentication-tolerate-lookup-failure", false,
          "If true, failures to look up missing authentication configuration from the cluster are not "
                + "considered fatal. Note that this can result in authentication that treats all requests "
                + "as anonymous.", this::setTolerateInClusterLookupFailure);
    flags.addStringFlag("client-ca-file", "",
          "If set, any request presenting a client certificate signed by one of the authorities in the "
                + "client-ca-file is authenticated with an identity corresponding to the CommonName of the "
                + "client certificate.", this::setClientCaFile);
  }

  /**
   * Configures request authentication.
   * @param authenticationInfo receives the authenticator, audiences and client CA
   * @param servingInfo the listener settings, which are told to request client certificates when a
   *     client CA is known
   * @param audiences supplies the audiences tokens must be issued for. May be null for no restriction.
   * @throws ConfigurationException if the delegated client or the client CA cannot be obtained
   */
  public void applyTo(AuthenticationInfo authenticationInfo, SecureServingInfo servingInfo,
                      @Nullable Supplier<List<String>> audiences) throws ConfigurationException {
    if (servingInfo == null) {
      throw new ConfigurationException("secure serving must be configured before delegated authentication");
    }

    ApiClient client = getClient();
    applyClientCa(authenticationInfo, servingInfo, client);

    List<String> apiAudiences = Optional.ofNullable(audiences).map(Supplier::get).orElse(Collections.emptyList());
    authenticationInfo.setApiAudiences(apiAudiences);
    authenticationInfo.setAuthenticator(createAuthenticator(client, apiAudiences));
  }

  private Authenticator createAuthenticator(@Nullable ApiClient client, List<String> apiAudiences) {
    return client == null
          ? Authenticator.anonymousOnly()
          : new TokenReviewAuthenticator(client, cacheTtl, apiAudiences);
  }

  @Nullable
  private ApiClient getClient() throws ConfigurationException {
    try {
      Optional<ApiClient> client = DelegatedClients.getClient(remoteKubeConfigFile);
      if (client.isEmpty() && !remoteKubeConfigFileOptional) {
        throw new ConfigurationException("failed to get delegated authentication kubeconfig: "
              + "no --authentication-kubeconfig given and not running in a cluster");
      } else if (client.isEmpty()) {
        LOGGER.warning(MessageKeys.NO_AUTHENTICATION_KUBECONFIG);
      }
      return client.orElse(null);
    } catch (IOException | ClientConstructionException e) {
      throw new ConfigurationException("failed to get delegated authentication kubeconfig: " + e.getMessage(), e);
    }
  }

  private void applyClientCa(AuthenticationInfo authenticationInfo, SecureServingInfo servingInfo,
                             @Nullable ApiClient client) throws ConfigurationException {
    byte[] clientCa = null;
    if (!clientCaFile.isEmpty()) {
      clientCa = readClientCaFile();
    } else if (skipInClusterLookup) {
      return;
    } else if (client == null) {
      LOGGER.warning(MessageKeys.NO_CLIENT_CA_LOOKUP_CLIENT,
            AUTHENTICATION_CONFIG_MAP_NAME, AUTHENTICATION_CONFIG_MAP_NAMESPACE);
    } else {
      clientCa = lookupClientCa(client);
    }

    if (clientCa != null) {
      authenticationInfo.setClientCa(clientCa);
      servingInfo.applyClientCert(clientCa);
    }
  }

  private byte[] readClientCaFile() throws ConfigurationException {
    try {
      return FileUtils.readFileToByteArray(new File(clientCaFile));
    } catch (IOException e) {
      throw new ConfigurationException(String.format(
            "unable to load client CA file %s: %s", clientCaFile, e.getMessage()), e);
    }
  }

  @Nullable
  private byte[] lookupClientCa(ApiClient client) throws ConfigurationException {
    try {
      return Optional.ofNullable(clientCaLookup.lookup(client))
            .map(ca -> ca.getBytes(StandardCharsets.UTF_8))
            .orElse(null);
    } catch (ApiException e) {
      if (!tolerateInClusterLookupFailure) {
        throw new ConfigurationException(String.format(
              "unable to load configmap based client-ca-file: %s. Usually fixed by granting read access "
                    + "to configmap/%s in %s, or set --authentication-tolerate-lookup-failure=true to continue",
              e.getMessage(), AUTHENTICATION_CONFIG_MAP_NAME, AUTHENTICATION_CONFIG_MAP_NAMESPACE), e);
      }
      LOGGER.warning(MessageKeys.CLIENT_CA_LOOKUP_FAILED,
            AUTHENTICATION_CONFIG_MAP_NAME, AUTHENTICATION_CONFIG_MAP_NAMESPACE, e.getMessage());
      return null;
    }
  }

  @Nullable
  private static String readClientCaFromCluster(ApiClient client) throws ApiException {
    V1ConfigMap configMap = new CoreV1Api(client)
          .readNamespacedConfigMap(AUTHENTICATION_CONFIG_MAP_NAME, AUTHENTICATION_CONFIG_MAP_NAMESPACE, null);
    return Optional.ofNullable(configMap.getData()).map(data -> data.get(CLIENT_CA_KEY)).orElse(null);
  }

  @FunctionalInterface
  interface ClientCaLookup {
    String lookup(ApiClient client) throws ApiException;
  }
}
