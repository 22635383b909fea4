// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

import io.kubernetes.client.openapi.ApiClient;
import oracle.kubernetes.adapter.client.ClientConstructionException;
import oracle.kubernetes.adapter.client.DelegatedClients;
import oracle.kubernetes.adapter.config.AuthorizationInfo;
import oracle.kubernetes.adapter.security.Authorizer;
import oracle.kubernetes.adapter.security.PathAuthorizer;
import oracle.kubernetes.adapter.security.PrivilegedGroupAuthorizer;
import oracle.kubernetes.adapter.security.SubjectAccessReviewAuthorizer;
import oracle.kubernetes.adapter.security.UnionAuthorizer;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;

/**
 * Options for authorizing requests. Members of the always-allowed groups and requests for the
 * always-allowed paths are let through; anything else is decided by the core Kubernetes API
 * server through SubjectAccessReviews.
 */
public class DelegatingAuthorizationOptions implements OptionSet {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  static final Duration DEFAULT_ALLOW_CACHE_TTL = Duration.ofSeconds(10);
  static final Duration DEFAULT_DENY_CACHE_TTL = Duration.ofSeconds(10);
  static final Duration DEFAULT_CLIENT_TIMEOUT = Duration.ofSeconds(10);
  static final int DEFAULT_RETRY_ATTEMPTS = 5;
  static final List<String> DEFAULT_ALWAYS_ALLOW_PATHS = List.of("/healthz", "/readyz", "/livez");
  static final List<String> DEFAULT_ALWAYS_ALLOW_GROUPS = List.of("system:masters");

  private String remoteKubeConfigFile = "";
  private boolean remoteKubeConfigFileOptional;
  private Duration allowCacheTtl = DEFAULT_ALLOW_CACHE_TTL;
  private Duration denyCacheTtl = DEFAULT_DENY_CACHE_TTL;
  private List<String> alwaysAllowPaths = new ArrayList<>(DEFAULT_ALWAYS_ALLOW_PATHS);
  private List<String> alwaysAllowGroups = new ArrayList<>(DEFAULT_ALWAYS_ALLOW_GROUPS);
  private Duration clientTimeout = DEFAULT_CLIENT_TIMEOUT;
  private int webhookRetryAttempts = DEFAULT_RETRY_ATTEMPTS;

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
   * Allows the server to run without a delegated client. Only the always-allowed groups and paths
   * are then authorized.
   * @param remoteKubeConfigFileOptional true to tolerate a missing client
   */
  public void setRemoteKubeConfigFileOptional(boolean remoteKubeConfigFileOptional) {
    this.remoteKubeConfigFileOptional = remoteKubeConfigFileOptional;
  }

  public Duration getAllowCacheTtl() {
    return allowCacheTtl;
  }

  public void setAllowCacheTtl(Duration allowCacheTtl) {
    this.allowCacheTtl = allowCacheTtl;
  }

  public Duration getDenyCacheTtl() {
    return denyCacheTtl;
  }

  public void setDenyCacheTtl(Duration denyCacheTtl) {
    this.denyCacheTtl = denyCacheTtl;
  }

  public List<String> getAlwaysAllowPaths() {
    return alwaysAllowPaths;
  }

  public void setAlwaysAllowPaths(List<String> alwaysAllowPaths) {
    this.alwaysAllowPaths = new ArrayList<>(alwaysAllowPaths);
  }

  public List<String> getAlwaysAllowGroups() {
    return alwaysAllowGroups;
  }

  public void setAlwaysAllowGroups(List<String> alwaysAllowGroups) {
    this.alwaysAllowGroups = new ArrayList<>(alwaysAllowGroups);
  }

  public Duration getClientTimeout() {
    return clientTimeout;
  }

  public void setClientTimeout(Duration clientTimeout) {
    this.clientTimeout = clientTimeout;
  }

  public int getWebhookRetryAttempts() {
    return webhookRetryAttempts;
  }

  public void setWebhookRetryAttempts(int webhookRetryAttempts) {
    this.webhookRetryAttempts = webhookRetryAttempts;
  }

  @Override
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (allowCacheTtl.isNegative()) {
      errors.add("--authorization-webhook-cache-authorized-ttl must not be negative");
    }
    if (denyCacheTtl.isNegative()) {
      errors.add("--authorization-webhook-cache-unauthorized-ttl must not be negative");
    }
    if (clientTimeout.isNegative() || clientTimeout.isZero()) {
      errors.add("--authorization-client-timeout must be positive");
    }
    if (webhookRetryAttempts <= 0) {
      errors.add("number of webhook retry attempts must be greater than 0, but is: " + webhookRetryAttempts);
    }
    return errors;
  }

  @Override
  public void addFlags(FlagSet flags) {
    flags.addStringFlag("authorization-kubeconfig", "",
          "kubeconfig file pointing at the 'core' kubernetes server with enough rights to create "
                + "subjectaccessreviews.authorization.k8s.io.", this::setRemoteKubeConfigFile);
    flags.addDurationFlag("authorization-webhook-cache-authorized-ttl", DEFAULT_ALLOW_CACHE_TTL,
          "The duration to cache 'authorized' responses from the webhook authorizer.", this::setAllowCacheTtl);
    flags.addDurationFlag("authorization-webhook-cache-unauthorized-ttl", DEFAULT_DENY_CACHE_TTL,
          "The duration to cache 'unauthorized' responses from the webhook authorizer.", this::setDenyCacheTtl);
    flags.addStringListFlag("authorization-always-allow-paths", DEFAULT_ALWAYS_ALLOW_PATHS,
          "A list of HTTP paths to skip during authorization, i.e. these are authorized without "
                + "contacting the 'core' kubernetes server.", this::setAlwaysAllowPaths);
    flags.addStringListFlag("authorization-always-allow-groups", DEFAULT_ALWAYS_ALLOW_GROUPS,
          "A list of groups whose members are authorized without contacting the 'core' kubernetes server.",
          this::setAlwaysAllowGroups);
    flags.addDurationFlag("authorization-client-timeout", DEFAULT_CLIENT_TIMEOUT,
          "The timeout for calls to the 'core' kubernetes server.", this::setClientTimeout);
    flags.addIntFlag("authorization-webhook-retry-attempts", DEFAULT_RETRY_ATTEMPTS,
          "The number of times a SubjectAccessReview is attempted before giving up.", this::setWebhookRetryAttempts);
  }

  /**
   * Configures request authorization.
   * @param authorizationInfo receives the authorizer
   * @throws ConfigurationException if the delegated client cannot be obtained or a path is malformed
   */
  public void applyTo(AuthorizationInfo authorizationInfo) throws ConfigurationException {
    authorizationInfo.setAuthorizer(toAuthorizer(getClient()));
  }

  private Authorizer toAuthorizer(@Nullable ApiClient client) throws ConfigurationException {
    List<Authorizer> authorizers = new ArrayList<>();
    if (!alwaysAllowGroups.isEmpty()) {
      authorizers.add(new PrivilegedGroupAuthorizer(alwaysAllowGroups));
    }
    if (!alwaysAllowPaths.isEmpty()) {
      try {
        authorizers.add(new PathAuthorizer(alwaysAllowPaths));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(e.getMessage(), e);
      }
    }

    if (client == null) {
      LOGGER.warning(MessageKeys.NO_AUTHORIZATION_KUBECONFIG);
    } else {
      int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, clientTimeout.toMillis());
      client.setReadTimeout(timeoutMillis);
      authorizers.add(
            new SubjectAccessReviewAuthorizer(client, allowCacheTtl, denyCacheTtl, webhookRetryAttempts));
    }
    return new UnionAuthorizer(authorizers);
  }

  @Nullable
  private ApiClient getClient() throws ConfigurationException {
    try {
      Optional<ApiClient> client = DelegatedClients.getClient(remoteKubeConfigFile);
      if (client.isEmpty() && !remoteKubeConfigFileOptional) {
        throw new ConfigurationException("failed to get delegated authorization kubeconfig: "
              + "no --authorization-kubeconfig given and not running in a cluster");
      }
      return client.orElse(null);
    } catch (IOException | ClientConstructionException e) {
      throw new ConfigurationException("failed to get delegated authorization kubeconfig: " + e.getMessage(), e);
    }
  }
}
