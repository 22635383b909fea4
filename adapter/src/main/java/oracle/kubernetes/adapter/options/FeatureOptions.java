// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.util.ArrayList;
import java.util.List;

import io.kubernetes.client.openapi.ApiClient;
import oracle.kubernetes.adapter.client.VersionedInformers;
import oracle.kubernetes.adapter.config.FlowControl;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.features.FeatureGates;
import oracle.kubernetes.adapter.features.FeatureGatesImpl;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;

/** Options for profiling, feature gates and API priority and fairness. */
public class FeatureOptions implements OptionSet {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  private boolean enableProfiling = true;
  private boolean enableContentionProfiling;
  private String debugSocketPath = "";
  private boolean enablePriorityAndFairness = true;
  private String featureGates = "";

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

  public String getDebugSocketPath() {
    return debugSocketPath;
  }

  public void setDebugSocketPath(String debugSocketPath) {
    this.debugSocketPath = debugSocketPath;
  }

  public boolean isEnablePriorityAndFairness() {
    return enablePriorityAndFairness;
  }

  public void setEnablePriorityAndFairness(boolean enablePriorityAndFairness) {
    this.enablePriorityAndFairness = enablePriorityAndFairness;
  }

  public String getFeatureGates() {
    return featureGates;
  }

  public void setFeatureGates(String featureGates) {
    this.featureGates = featureGates;
  }

  @Override
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    FeatureGatesImpl.validate(featureGates).forEach(e -> errors.add("--feature-gates: " + e));
    return errors;
  }

  @Override
  public void addFlags(FlagSet flags) {
    flags.addBooleanFlag("profiling", true, "Enable profiling via web interface host:port/debug/pprof/",
          this::setEnableProfiling);
    flags.addBooleanFlag("contention-profiling", false,
          "Enable lock contention profiling, if profiling is enabled", this::setEnableContentionProfiling);
    flags.addStringFlag("debug-socket-path", "",
          "Use an unprotected (no authn/authz) unix-domain socket for profiling with the given path",
          this::setDebugSocketPath);
    flags.addBooleanFlag("enable-priority-and-fairness", true,
          "If true and the APIPriorityAndFairness feature gate is enabled, "
                + "replace the max-in-flight handler with an enhanced one that queues and dispatches with "
                + "priority and fairness", this::setEnablePriorityAndFairness);
    flags.addStringFlag("feature-gates", "",
          "A set of key=value pairs that describe feature gates for alpha/experimental features. Options are: "
                + String.join("=true|false, ", FeatureGatesImpl.getKnownFeatures()) + "=true|false",
          this::setFeatureGates);
  }

  /**
   * Applies the profiling flags and feature gates, and sets up flow control.
   * @param serverConfig the configuration to update
   * @param client the external client, used by flow control for writes
   * @param informers the shared informer factory, which is not started here
   * @throws ConfigurationException if flow control is enabled without any request capacity
   */
  public void applyTo(ServerConfig serverConfig, ApiClient client, VersionedInformers informers)
        throws ConfigurationException {
    serverConfig.setEnableProfiling(enableProfiling);
    serverConfig.setDebugSocketPath(debugSocketPath);
    serverConfig.setEnableContentionProfiling(enableContentionProfiling);
    if (enableProfiling) {
      LOGGER.config(MessageKeys.PROFILING_ENABLED, enableContentionProfiling);
    }

    FeatureGates gates = new FeatureGatesImpl(featureGates);
    serverConfig.setFeatureGates(gates);
    LOGGER.config(MessageKeys.FEATURE_GATES, gates);

    if (enablePriorityAndFairness && gates.isFeatureEnabled(FeatureGates.API_PRIORITY_AND_FAIRNESS)) {
      int totalLimit = serverConfig.getMaxRequestsInFlight() + serverConfig.getMaxMutatingRequestsInFlight();
      if (totalLimit <= 0) {
        throw new ConfigurationException(String.format("invalid configuration: MaxRequestsInFlight=%d and "
                    + "MaxMutatingRequestsInFlight=%d; they must add up to something positive",
              serverConfig.getMaxRequestsInFlight(), serverConfig.getMaxMutatingRequestsInFlight()));
      }
      serverConfig.setFlowControl(new FlowControl(client, informers, totalLimit));
      LOGGER.info(MessageKeys.FLOW_CONTROL_ENABLED, totalLimit);
    }
  }
}
