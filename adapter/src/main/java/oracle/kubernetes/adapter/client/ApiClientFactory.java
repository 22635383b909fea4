// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.client;

import java.time.Duration;

import io.kubernetes.client.openapi.ApiClient;

/** Derives a Kubernetes API client, and the informers bound to it, from a client configuration. */
public interface ApiClientFactory {

  /**
   * Creates a new API client.
   * @param clientConfig the endpoint and credentials to use
   * @return a client which has not yet contacted the server
   * @throws ClientConstructionException if the configuration cannot be turned into a client
   */
  ApiClient createClient(ClientConfig clientConfig) throws ClientConstructionException;

  /**
   * Creates a shared informer factory bound to the specified client.
   * @param client an API client
   * @param resyncPeriod how often informers created by the factory replay their caches
   * @return a new factory, not yet started
   * @throws ClientConstructionException if no watch client can be derived from the client
   */
  VersionedInformers createInformers(ApiClient client, Duration resyncPeriod) throws ClientConstructionException;
}
