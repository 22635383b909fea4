// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.client;

import java.io.IOException;
import java.util.Optional;

import io.kubernetes.client.openapi.ApiClient;

/**
 * Supplies the clients used to delegate authentication and authorization decisions to the core
 * Kubernetes API server.
 */
public class DelegatedClients {

  @SuppressWarnings("FieldMayBeFinal") // stubbed in unit tests
  private static DelegatedClientFactory factory = new DefaultDelegatedClientFactory();

  private DelegatedClients() {
  }

  /**
   * Returns a client for delegated calls.
   * @param kubeconfigPath a kubeconfig file with enough rights to create token reviews or subject
   *     access reviews. May be empty, in which case the in-cluster configuration is used.
   * @return the client, or empty if no kubeconfig file was named and the process is not running in
   *     a cluster
   * @throws IOException if the configuration cannot be read
   * @throws ClientConstructionException if the configuration does not describe a usable client
   */
  public static Optional<ApiClient> getClient(String kubeconfigPath) throws IOException, ClientConstructionException {
    return factory.createClient(kubeconfigPath);
  }

  public interface DelegatedClientFactory {
    Optional<ApiClient> createClient(String kubeconfigPath) throws IOException, ClientConstructionException;
  }

  static class DefaultDelegatedClientFactory implements DelegatedClientFactory {
    private final ApiClientFactory clientFactory = new DefaultApiClientFactory();

    @Override
    public Optional<ApiClient> createClient(String kubeconfigPath) throws IOException, ClientConstructionException {
      if ((kubeconfigPath == null || kubeconfigPath.isEmpty()) && !ClientConfigLoader.isInCluster()) {
        return Optional.empty();
      }
      return Optional.of(clientFactory.createClient(ClientConfigLoader.load(kubeconfigPath)));
    }
  }
}
