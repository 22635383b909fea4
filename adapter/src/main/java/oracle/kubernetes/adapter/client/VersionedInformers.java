// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.client;

import java.time.Duration;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.auth.ApiKeyAuth;
import io.kubernetes.client.openapi.auth.Authentication;
import io.kubernetes.client.util.generic.GenericKubernetesApi;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A shared informer factory whose informers all resync on the same fixed period. Creating
 * informers does not contact the server; nothing is watched until {@link #start()} is called.
 */
public class VersionedInformers {

  static final String BEARER_TOKEN_AUTH = "BearerToken";

  private final ApiClient watchClient;
  private final SharedInformerFactory factory;
  private final Duration resyncPeriod;

  VersionedInformers(ApiClient client, Duration resyncPeriod) {
    this.watchClient = createWatchClient(client);
    this.factory = new SharedInformerFactory(watchClient);
    this.resyncPeriod = resyncPeriod;
  }

  /**
   * Returns a copy of the specified client which never times out reads, as watches hold their
   * connections open. The copy shares the endpoint, TLS settings and credentials of the original,
   * which is left unchanged.
   * @param client an API client
   * @return a client suitable for watches
   */
  static ApiClient createWatchClient(ApiClient client) {
    ApiClient watchClient = new ApiClient(client.getHttpClient().newBuilder().readTimeout(0, SECONDS).build());
    watchClient.setBasePath(client.getBasePath());

    Authentication source = client.getAuthentication(BEARER_TOKEN_AUTH);
    Authentication target = watchClient.getAuthentication(BEARER_TOKEN_AUTH);
    if (source instanceof ApiKeyAuth && target instanceof ApiKeyAuth) {
      ((ApiKeyAuth) target).setApiKey(((ApiKeyAuth) source).getApiKey());
      ((ApiKeyAuth) target).setApiKeyPrefix(((ApiKeyAuth) source).getApiKeyPrefix());
    }
    return watchClient;
  }

  public ApiClient getWatchClient() {
    return watchClient;
  }

  public Duration getResyncPeriod() {
    return resyncPeriod;
  }

  public SharedInformerFactory getSharedInformerFactory() {
    return factory;
  }

  /**
   * Returns the informer for the specified resource type, creating it if this is the first request.
   * @param apiTypeClass the resource type
   * @param apiListTypeClass the list type for the resource
   * @param apiGroup the API group of the resource
   * @param apiVersion the version of the API group
   * @param resourcePlural the plural name of the resource
   * @param <T> the resource type
   * @param <L> the list type for the resource
   * @return a shared informer
   */
  public <T extends KubernetesObject, L extends KubernetesListObject> SharedIndexInformer<T> informerFor(
        Class<T> apiTypeClass, Class<L> apiListTypeClass, String apiGroup, String apiVersion, String resourcePlural) {
    GenericKubernetesApi<T, L> api = new GenericKubernetesApi<>(
          apiTypeClass, apiListTypeClass, apiGroup, apiVersion, resourcePlural, watchClient);
    return factory.sharedIndexInformerFor(api, apiTypeClass, resyncPeriod.toMillis());
  }

  public void start() {
    factory.startAllRegisteredInformers();
  }

  public void stop() {
    factory.stopAllRegisteredInformers();
  }
}
