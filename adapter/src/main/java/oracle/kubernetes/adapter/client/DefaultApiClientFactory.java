// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.credentials.AccessTokenAuthentication;
import io.kubernetes.client.util.credentials.Authentication;
import io.kubernetes.client.util.credentials.ClientCertificateAuthentication;
import io.kubernetes.client.util.credentials.UsernamePasswordAuthentication;

/** Builds real API clients with the Kubernetes java client. */
public class DefaultApiClientFactory implements ApiClientFactory {

  static final String BAD_HOST_MESSAGE = "host must be a URL or a host:port pair";

  @Override
  public ApiClient createClient(ClientConfig clientConfig) throws ClientConstructionException {
    String basePath = toBasePath(clientConfig.getHost());

    try {
      ClientBuilder builder = new ClientBuilder()
            .setBasePath(basePath)
            .setVerifyingSsl(!clientConfig.isInsecure());
      if (clientConfig.getCaData() != null) {
        builder.setCertificateAuthority(clientConfig.getCaData());
      }
      Authentication authentication = selectAuthentication(clientConfig);
      if (authentication != null) {
        builder.setAuthentication(authentication);
      }

      ApiClient client = builder.build();
      clientConfig.getTimeout().ifPresent(t -> setTimeouts(client, t));
      return client;
    } catch (RuntimeException e) {
      throw new ClientConstructionException(e.getMessage(), e);
    }
  }

  private void setTimeouts(ApiClient client, Duration timeout) {
    int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    client.setConnectTimeout(millis);
    client.setReadTimeout(millis);
  }

  private Authentication selectAuthentication(ClientConfig clientConfig) {
    if (clientConfig.getCertData() != null && clientConfig.getKeyData() != null) {
      return new ClientCertificateAuthentication(clientConfig.getCertData(), clientConfig.getKeyData());
    } else if (clientConfig.getBearerToken() != null) {
      return new AccessTokenAuthentication(clientConfig.getBearerToken());
    } else if (clientConfig.getUsername() != null) {
      return new UsernamePasswordAuthentication(clientConfig.getUsername(), clientConfig.getPassword());
    } else {
      return null;
    }
  }

  /**
   * Converts a host setting to the base path of the API server. A bare host or host:port pair
   * is taken to be an https address.
   * @param host the configured host
   * @return the base path
   * @throws ClientConstructionException if the host is missing or malformed
   */
  static String toBasePath(String host) throws ClientConstructionException {
    if (host == null || host.isBlank()) {
      throw new ClientConstructionException(BAD_HOST_MESSAGE);
    }

    String candidate = host.contains("://") ? host : "https://" + host;
    try {
      URI uri = new URI(candidate);
      if (!isHttpScheme(uri.getScheme()) || uri.getHost() == null) {
        throw new ClientConstructionException(BAD_HOST_MESSAGE + ": " + host);
      }
      return candidate.endsWith("/") ? candidate.substring(0, candidate.length() - 1) : candidate;
    } catch (URISyntaxException e) {
      throw new ClientConstructionException(BAD_HOST_MESSAGE + ": " + host, e);
    }
  }

  private static boolean isHttpScheme(String scheme) {
    return "https".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme);
  }

  @Override
  public VersionedInformers createInformers(ApiClient client, Duration resyncPeriod)
        throws ClientConstructionException {
    try {
      return new VersionedInformers(client, resyncPeriod);
    } catch (RuntimeException e) {
      throw new ClientConstructionException(e.getMessage(), e);
    }
  }
}
