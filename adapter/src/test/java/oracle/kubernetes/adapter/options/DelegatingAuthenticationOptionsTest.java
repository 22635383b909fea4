// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.logging.LogRecord;

import com.meterware.simplestub.Memento;
import com.meterware.simplestub.StaticStubSupport;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import oracle.kubernetes.adapter.client.DelegatedClients;
import oracle.kubernetes.adapter.config.AuthenticationInfo;
import oracle.kubernetes.adapter.config.CertKey;
import oracle.kubernetes.adapter.config.SecureServingInfo;
import oracle.kubernetes.adapter.security.TokenReviewAuthenticator;
import oracle.kubernetes.adapter.security.UserInfo;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static oracle.kubernetes.common.logging.MessageKeys.CLIENT_CA_LOOKUP_FAILED;
import static oracle.kubernetes.common.logging.MessageKeys.NO_AUTHENTICATION_KUBECONFIG;
import static oracle.kubernetes.common.logging.MessageKeys.NO_CLIENT_CA_LOOKUP_CLIENT;
import static oracle.kubernetes.utils.LogMatcher.containsWarning;
import static oracle.kubernetes.utils.TestUtils.silenceAdapterLogger;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DelegatingAuthenticationOptionsTest {

  private static final String CLIENT_CA = "-----BEGIN CERTIFICATE-----\nclient-ca\n-----END CERTIFICATE-----\n";

  private final List<Memento> mementos = new ArrayList<>();
  private final Collection<LogRecord> logRecords = new ArrayList<>();
  private final DelegatingAuthenticationOptions options = new DelegatingAuthenticationOptions();
  private final AuthenticationInfo authenticationInfo = new AuthenticationInfo();
  private final SecureServingInfo servingInfo =
        new SecureServingInfo("0.0.0.0", 443, new CertKey(new byte[0], new byte[0]), "TLSv1.2", List.of());
  private final ApiClient client = new ApiClient();
  private Optional<ApiClient> delegatedClient = Optional.of(client);
  private String clusterClientCa = CLIENT_CA;
  private ApiException lookupFailure;

  @TempDir
  Path tempDir;

  @BeforeEach
  void setUp() throws NoSuchFieldException {
    mementos.add(silenceAdapterLogger()
          .collectLogMessages(logRecords, NO_AUTHENTICATION_KUBECONFIG, NO_CLIENT_CA_LOOKUP_CLIENT,
                CLIENT_CA_LOOKUP_FAILED));
    mementos.add(StaticStubSupport.install(DelegatedClients.class, "factory",
          (DelegatedClients.DelegatedClientFactory) path -> delegatedClient));
    mementos.add(StaticStubSupport.install(DelegatingAuthenticationOptions.class, "clientCaLookup",
          (DelegatingAuthenticationOptions.ClientCaLookup) this::lookupClientCa));
  }

  @AfterEach
  void tearDown() {
    mementos.forEach(Memento::revert);
  }

  private String lookupClientCa(ApiClient apiClient) throws ApiException {
    if (lookupFailure != null) {
      throw lookupFailure;
    }
    return clusterClientCa;
  }

  @Test
  void defaultOptions_areValid() {
    assertThat(options.validate(), empty());
  }

  @Test
  void whenCacheTtlNegative_reportError() {
    options.setCacheTtl(Duration.ofSeconds(-1));

    assertThat(options.validate(), contains("--authentication-token-webhook-cache-ttl must not be negative"));
  }

  @Test
  void flags_setOptions() throws Exception {
    FlagSet flags = new FlagSet();
    options.addFlags(flags);
    flags.parse("--authentication-kubeconfig=/etc/kube/config", "--authentication-token-webhook-cache-ttl=1m",
          "--authentication-tolerate-lookup-failure");

    assertThat(options.getRemoteKubeConfigFile(), equalTo("/etc/kube/config"));
    assertThat(options.getCacheTtl(), equalTo(Duration.ofMinutes(1)));
    assertThat(options.isTolerateInClusterLookupFailure(), equalTo(true));
  }

  @Test
  void whenServingInfoMissing_fail() {
    assertThrows(ConfigurationException.class, () -> options.applyTo(authenticationInfo, null, null));
  }

  @Test
  void withClient_useTokenReviews() throws ConfigurationException {
    options.applyTo(authenticationInfo, servingInfo, null);

    assertThat(authenticationInfo.getAuthenticator(), instanceOf(TokenReviewAuthenticator.class));
    assertThat(((TokenReviewAuthenticator) authenticationInfo.getAuthenticator()).getCacheTtl(),
          equalTo(Duration.ofSeconds(10)));
  }

  @Test
  void whenAudiencesSupplied_passThemOn() throws ConfigurationException {
    options.applyTo(authenticationInfo, servingInfo, () -> List.of("adapter"));

    assertThat(authenticationInfo.getApiAudiences(), contains("adapter"));
  }

  @Test
  void whenNoClientAndClientRequired_fail() {
    delegatedClient = Optional.empty();

    ConfigurationException e = assertThrows(ConfigurationException.class,
          () -> options.applyTo(authenticationInfo, servingInfo, null));
    assertThat(e.getMessage(), containsString("failed to get delegated authentication kubeconfig"));
  }

  @Test
  void whenNoClientAndClientOptional_acceptOnlyAnonymousRequests() throws ConfigurationException {
    delegatedClient = Optional.empty();
    options.setRemoteKubeConfigFileOptional(true);
    options.applyTo(authenticationInfo, servingInfo, null);

    assertThat(authenticationInfo.getAuthenticator().authenticate(null), equalTo(Optional.of(UserInfo.anonymous())));
    assertThat(authenticationInfo.getAuthenticator().authenticate("token"), equalTo(Optional.empty()));
    assertThat(logRecords, containsWarning(NO_AUTHENTICATION_KUBECONFIG));
    assertThat(logRecords, containsWarning(NO_CLIENT_CA_LOOKUP_CLIENT));
  }

  @Test
  void whenClientCaFileSet_readIt() throws IOException, ConfigurationException {
    File caFile = tempDir.resolve("ca.crt").toFile();
    FileUtils.writeStringToFile(caFile, "file-ca", StandardCharsets.UTF_8);
    options.setClientCaFile(caFile.getPath());
    options.applyTo(authenticationInfo, servingInfo, null);

    assertThat(new String(authenticationInfo.getClientCa(), StandardCharsets.UTF_8), equalTo("file-ca"));
    assertThat(servingInfo.getClientCa(), equalTo(authenticationInfo.getClientCa()));
  }

  @Test
  void whenClientCaFileMissing_fail() {
    options.setClientCaFile(tempDir.resolve("missing.crt").toString());

    assertThrows(ConfigurationException.class, () -> options.applyTo(authenticationInfo, servingInfo, null));
  }

  @Test
  void whenNoClientCaFile_lookItUpInCluster() throws ConfigurationException {
    options.applyTo(authenticationInfo, servingInfo, null);

    assertThat(new String(servingInfo.getClientCa(), StandardCharsets.UTF_8), equalTo(CLIENT_CA));
  }

  @Test
  void whenLookupSkipped_requestNoClientCertificates() throws ConfigurationException {
    options.setSkipInClusterLookup(true);
    options.applyTo(authenticationInfo, servingInfo, null);

    assertThat(servingInfo.getClientCa(), nullValue());
  }

  @Test
  void whenLookupFails_fail() {
    lookupFailure = new ApiException(403, "forbidden");

    ConfigurationException e = assertThrows(ConfigurationException.class,
          () -> options.applyTo(authenticationInfo, servingInfo, null));
    assertThat(e.getMessage(), containsString("unable to load configmap based client-ca-file"));
  }

  @Test
  void whenLookupFailureTolerated_warnAndContinue() throws ConfigurationException {
    lookupFailure = new ApiException(403, "forbidden");
    options.setTolerateInClusterLookupFailure(true);
    options.applyTo(authenticationInfo, servingInfo, null);

    assertThat(servingInfo.getClientCa(), nullValue());
    assertThat(logRecords, containsWarning(CLIENT_CA_LOOKUP_FAILED));
  }
}
