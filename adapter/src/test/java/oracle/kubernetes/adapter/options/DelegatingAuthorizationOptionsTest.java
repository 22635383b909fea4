// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.logging.LogRecord;

import com.meterware.simplestub.Memento;
import com.meterware.simplestub.StaticStubSupport;
import io.kubernetes.client.openapi.ApiClient;
import oracle.kubernetes.adapter.client.DelegatedClients;
import oracle.kubernetes.adapter.config.AuthorizationInfo;
import oracle.kubernetes.adapter.security.Decision;
import oracle.kubernetes.adapter.security.RequestAttributes;
import oracle.kubernetes.adapter.security.UserInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static oracle.kubernetes.common.logging.MessageKeys.NO_AUTHORIZATION_KUBECONFIG;
import static oracle.kubernetes.utils.LogMatcher.containsWarning;
import static oracle.kubernetes.utils.TestUtils.silenceAdapterLogger;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DelegatingAuthorizationOptionsTest {

  private final List<Memento> mementos = new ArrayList<>();
  private final Collection<LogRecord> logRecords = new ArrayList<>();
  private final DelegatingAuthorizationOptions options = new DelegatingAuthorizationOptions();
  private final AuthorizationInfo authorizationInfo = new AuthorizationInfo();
  private final ApiClient client = new ApiClient();
  private Optional<ApiClient> delegatedClient = Optional.of(client);

  @BeforeEach
  void setUp() throws NoSuchFieldException {
    mementos.add(silenceAdapterLogger().collectLogMessages(logRecords, NO_AUTHORIZATION_KUBECONFIG));
    mementos.add(StaticStubSupport.install(DelegatedClients.class, "factory",
          (DelegatedClients.DelegatedClientFactory) path -> delegatedClient));
  }

  @AfterEach
  void tearDown() {
    mementos.forEach(Memento::revert);
  }

  private Decision authorize(UserInfo user, String path) {
    return authorizationInfo.getAuthorizer().authorize(new RequestAttributes(user, "GET", path));
  }

  @Test
  void defaultOptions_areValid() {
    assertThat(options.validate(), empty());
  }

  @Test
  void invalidDurationsAndRetries_reportErrors() {
    options.setAllowCacheTtl(Duration.ofSeconds(-1));
    options.setDenyCacheTtl(Duration.ofSeconds(-1));
    options.setClientTimeout(Duration.ZERO);
    options.setWebhookRetryAttempts(0);

    assertThat(options.validate(), contains(
          "--authorization-webhook-cache-authorized-ttl must not be negative",
          "--authorization-webhook-cache-unauthorized-ttl must not be negative",
          "--authorization-client-timeout must be positive",
          "number of webhook retry attempts must be greater than 0, but is: 0"));
  }

  @Test
  void flags_setOptions() throws Exception {
    FlagSet flags = new FlagSet();
    options.addFlags(flags);
    flags.parse("--authorization-always-allow-paths=/healthz,/metrics",
          "--authorization-always-allow-groups=admins", "--authorization-webhook-retry-attempts=2");

    assertThat(options.getAlwaysAllowPaths(), containsInAnyOrder("/healthz", "/metrics"));
    assertThat(options.getAlwaysAllowGroups(), contains("admins"));
    assertThat(options.getWebhookRetryAttempts(), equalTo(2));
  }

  @Test
  void whenNoClientAndClientRequired_fail() {
    delegatedClient = Optional.empty();

    ConfigurationException e = assertThrows(ConfigurationException.class, () -> options.applyTo(authorizationInfo));
    assertThat(e.getMessage(), containsString("failed to get delegated authorization kubeconfig"));
  }

  @Test
  void whenNoClientAndClientOptional_authorizeOnlyAllowedPathsAndGroups() throws ConfigurationException {
    delegatedClient = Optional.empty();
    options.setRemoteKubeConfigFileOptional(true);
    options.applyTo(authorizationInfo);

    assertThat(authorize(UserInfo.anonymous(), "/healthz"), equalTo(Decision.ALLOW));
    assertThat(authorize(new UserInfo("admin", null, List.of("system:masters")), "/metrics"),
          equalTo(Decision.ALLOW));
    assertThat(authorize(UserInfo.anonymous(), "/metrics"), equalTo(Decision.NO_OPINION));
    assertThat(logRecords, containsWarning(NO_AUTHORIZATION_KUBECONFIG));
  }

  @Test
  void withClient_applyClientTimeout() throws ConfigurationException {
    options.setClientTimeout(Duration.ofSeconds(3));
    options.applyTo(authorizationInfo);

    assertThat(client.getReadTimeout(), equalTo(3000));
  }

  @Test
  void whenPathHasInnerStar_fail() {
    options.setAlwaysAllowPaths(List.of("/a/*/b"));

    ConfigurationException e = assertThrows(ConfigurationException.class, () -> options.applyTo(authorizationInfo));
    assertThat(e.getMessage(), containsString("only trailing * allowed"));
  }
}
