// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.util.UUID;
import java.util.function.Consumer;

import oracle.kubernetes.adapter.config.LoopbackClientConfig;
import oracle.kubernetes.adapter.config.SecureServingInfo;

/**
 * Secure serving options which also produce a client configuration the server can use to call
 * itself. The loopback client authenticates with a random bearer token and trusts the serving
 * certificate.
 */
public class SecureServingOptionsWithLoopback extends SecureServingOptions {

  /**
   * Builds the listener settings and the loopback client configuration.
   * @param servingTarget receives the listener settings
   * @param loopbackTarget receives the loopback client configuration
   * @throws ConfigurationException if the serving certificate cannot be loaded
   */
  public void applyTo(Consumer<SecureServingInfo> servingTarget, Consumer<LoopbackClientConfig> loopbackTarget)
        throws ConfigurationException {
    SecureServingInfo servingInfo = createServingInfo();
    servingTarget.accept(servingInfo);
    loopbackTarget.accept(new LoopbackClientConfig(
          "https://" + getLoopbackHostPort(servingInfo), UUID.randomUUID().toString(),
          servingInfo.getCertKey().getCertificate()));
  }

  private String getLoopbackHostPort(SecureServingInfo servingInfo) {
    String host = isUnspecified(servingInfo.getBindAddress()) ? "127.0.0.1" : servingInfo.getBindAddress();
    if (host.contains(":")) {
      host = "[" + host + "]";
    }
    return host + ":" + servingInfo.getPort();
  }
}
