// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import javax.annotation.Nullable;

import oracle.kubernetes.adapter.audit.AuditBackend;
import oracle.kubernetes.adapter.audit.AuditPolicy;
import oracle.kubernetes.adapter.features.FeatureGates;

/**
 * The runtime configuration of the server. Options fill in its slots; the server engine reads them
 * when it starts. A slot which no option touched keeps its default.
 */
public class ServerConfig {

  public static final int DEFAULT_MAX_REQUESTS_IN_FLIGHT = 400;
  public static final int DEFAULT_MAX_MUTATING_REQUESTS_IN_FLIGHT = 200;

  private SecureServingInfo secureServing;
  private LoopbackClientConfig loopbackClientConfig;
  private final AuthenticationInfo authentication = new AuthenticationInfo();
  private final AuthorizationInfo authorization = new AuthorizationInfo();
  private AuditBackend auditBackend;
  private AuditPolicy auditPolicy;
  private OpenApiConfig openApiConfig;
  private OpenApiV3Config openApiV3Config;
  private boolean enableMetrics;
  private boolean enableProfiling;
  private boolean enableContentionProfiling;
  private String debugSocketPath;
  private FeatureGates featureGates;
  private FlowControl flowControl;
  private int maxRequestsInFlight = DEFAULT_MAX_REQUESTS_IN_FLIGHT;
  private int maxMutatingRequestsInFlight = DEFAULT_MAX_MUTATING_REQUESTS_IN_FLIGHT;

  @Nullable
  public SecureServingInfo getSecureServing() {
    return secureServing;
  }

  public void setSecureServing(SecureServingInfo secureServing) {
    this.secureServing = secureServing;
  }

  @Nullable
  public LoopbackClientConfig getLoopbackClientConfig() {
    return loopbackClientConfig;
  }

  public void setLoopbackClientConfig(LoopbackClientConfig loopbackClientConfig) {
    this.loopbackClientConfig = loopbackClientConfig;
  }

  public AuthenticationInfo getAuthentication() {
    return authentication;
  }

  public AuthorizationInfo getAuthorization() {
    return authorization;
  }

  @Nullable
  public AuditBackend getAuditBackend() {
    return auditBackend;
  }

  public void setAuditBackend(AuditBackend auditBackend) {
    this.auditBackend = auditBackend;
  }

  @Nullable
  public AuditPolicy getAuditPolicy() {
    return auditPolicy;
  }

  public void setAuditPolicy(AuditPolicy auditPolicy) {
    this.auditPolicy = auditPolicy;
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

  public boolean isEnableProfiling() {
    return enableProfiling;
  }

  public void setEnableProfiling(boolean enableProfiling) {
    this.enableProfiling = enableProfiling;
  }

  public boolean isEnableContentionProfiling() {
    return enableContentionProfiling;
  }

  public void setEnableContentionProfiling(boolean enableContentionProfiling) {
    this.enableContentionProfiling = enableContentionProfiling;
  }

  @Nullable
  public String getDebugSocketPath() {
    return debugSocketPath;
  }

  public void setDebugSocketPath(String debugSocketPath) {
    this.debugSocketPath = debugSocketPath;
  }

  @Nullable
  public FeatureGates getFeatureGates() {
    return featureGates;
  }

  public void setFeatureGates(FeatureGates featureGates) {
    this.featureGates = featureGates;
  }

  @Nullable
  public FlowControl getFlowControl() {
    return flowControl;
  }

  public void setFlowControl(FlowControl flowControl) {
    this.flowControl = flowControl;
  }

  public int getMaxRequestsInFlight() {
    return maxRequestsInFlight;
  }

  public void setMaxRequestsInFlight(int maxRequestsInFlight) {
    this.maxRequestsInFlight = maxRequestsInFlight;
  }

  public int getMaxMutatingRequestsInFlight() {
    return maxMutatingRequestsInFlight;
  }

  public void setMaxMutatingRequestsInFlight(int maxMutatingRequestsInFlight) {
    this.maxMutatingRequestsInFlight = maxMutatingRequestsInFlight;
  }
}
