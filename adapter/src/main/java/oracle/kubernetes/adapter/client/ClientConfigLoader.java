// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.client;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;
import java.util.function.Function;

import io.kubernetes.client.util.Config;
import io.kubernetes.client.util.KubeConfig;
import org.apache.commons.io.FileUtils;

/**
 * Reads a {@link ClientConfig} from a kubeconfig file, or from the service account mounted into
 * a pod.
 */
public class ClientConfigLoader {

  @SuppressWarnings("FieldMayBeFinal") // stubbed in unit tests
  private static Function<String, String> getEnv = System::getenv;

  @SuppressWarnings("FieldMayBeFinal") // stubbed in unit tests
  private static String serviceAccountDir = new File(Config.SERVICEACCOUNT_TOKEN_PATH).getParent();

  private ClientConfigLoader() {
  }

  /**
   * Returns true if the process runs inside a Kubernetes pod.
   */
  public static boolean isInCluster() {
    return getEnv.apply(Config.ENV_SERVICE_HOST) != null && getEnv.apply(Config.ENV_SERVICE_PORT) != null;
  }

  /**
   * Loads the client configuration. An explicit kubeconfig file wins; without one, the in-cluster
   * service account is used.
   * @param kubeconfigPath the path to a kubeconfig file. May be null or empty.
   * @return the configuration
   * @throws IOException if the configuration cannot be read, or there is neither a kubeconfig
   *     file nor an in-cluster service account
   */
  public static ClientConfig load(String kubeconfigPath) throws IOException {
    if (kubeconfigPath != null && !kubeconfigPath.isEmpty()) {
      return fromKubeconfig(new File(kubeconfigPath));
    } else if (isInCluster()) {
      return inCluster();
    } else {
      throw new IOException("unable to load in-cluster configuration, "
            + Config.ENV_SERVICE_HOST + " and " + Config.ENV_SERVICE_PORT + " must be defined");
    }
  }

  /**
   * Reads the current context of a kubeconfig file.
   * @param file the kubeconfig file
   * @return the configuration
   * @throws IOException if the file cannot be read
   */
  public static ClientConfig fromKubeconfig(File file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      KubeConfig kubeConfig = KubeConfig.loadKubeConfig(reader);
      kubeConfig.setFile(file);

      ClientConfig.Builder builder = ClientConfig.builder()
            .host(kubeConfig.getServer())
            .insecure(!kubeConfig.verifySSL())
            .caData(kubeConfig.getDataOrFileRelative(
                  kubeConfig.getCertificateAuthorityData(), kubeConfig.getCertificateAuthorityFile()));

      byte[] certData = kubeConfig.getDataOrFileRelative(
            kubeConfig.getClientCertificateData(), kubeConfig.getClientCertificateFile());
      byte[] keyData = kubeConfig.getDataOrFileRelative(kubeConfig.getClientKeyData(), kubeConfig.getClientKeyFile());
      if (certData != null && keyData != null) {
        builder.clientCertificate(certData, keyData);
      }
      if (kubeConfig.getUsername() != null) {
        builder.basicAuth(kubeConfig.getUsername(), kubeConfig.getPassword());
      }
      String token = Optional.ofNullable(kubeConfig.getCredentials())
            .map(credentials -> credentials.get(KubeConfig.CRED_TOKEN_KEY))
            .orElse(null);
      if (token != null) {
        builder.bearerToken(token);
      }
      return builder.build();
    }
  }

  private static ClientConfig inCluster() throws IOException {
    String host = getEnv.apply(Config.ENV_SERVICE_HOST);
    String port = getEnv.apply(Config.ENV_SERVICE_PORT);
    File tokenFile = new File(serviceAccountDir, "token");
    File caFile = new File(serviceAccountDir, "ca.crt");

    return ClientConfig.builder()
          .host("https://" + joinHostPort(host, port))
          .bearerToken(FileUtils.readFileToString(tokenFile, StandardCharsets.UTF_8).trim())
          .caData(FileUtils.readFileToByteArray(caFile))
          .build();
  }

  private static String joinHostPort(String host, String port) {
    return host.contains(":") ? "[" + host + "]:" + port : host + ":" + port;
  }
}
