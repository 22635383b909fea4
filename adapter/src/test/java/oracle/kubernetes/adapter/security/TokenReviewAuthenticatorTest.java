// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.logging.LogRecord;

import com.meterware.simplestub.Memento;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1TokenReview;
import io.kubernetes.client.openapi.models.V1TokenReviewStatus;
import io.kubernetes.client.openapi.models.V1UserInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static oracle.kubernetes.common.logging.MessageKeys.APIEXCEPTION_FROM_TOKEN_REVIEW;
import static oracle.kubernetes.utils.LogMatcher.containsSevere;
import static oracle.kubernetes.utils.TestUtils.silenceAdapterLogger;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

class TokenReviewAuthenticatorTest {

  private static final String TOKEN = "a-token";
  private static final Duration TTL = Duration.ofSeconds(10);

  private final List<Memento> mementos = new ArrayList<>();
  private final Collection<LogRecord> logRecords = new ArrayList<>();
  private final List<V1TokenReview> requests = new ArrayList<>();
  private final TestTicker ticker = new TestTicker();
  private V1TokenReviewStatus status = new V1TokenReviewStatus().authenticated(true)
        .user(new V1UserInfo().username("jane").uid("1234").groups(List.of("devs")));
  private ApiException failure;

  @BeforeEach
  void setUp() {
    mementos.add(silenceAdapterLogger()
          .collectLogMessages(logRecords, APIEXCEPTION_FROM_TOKEN_REVIEW)
          .ignoringLoggedExceptions(ApiException.class));
  }

  @AfterEach
  void tearDown() {
    mementos.forEach(Memento::revert);
  }

  private V1TokenReview createReview(V1TokenReview body) throws ApiException {
    requests.add(body);
    if (failure != null) {
      throw failure;
    }
    return new V1TokenReview().status(status);
  }

  private TokenReviewAuthenticator createAuthenticator(List<String> audiences) {
    return new TokenReviewAuthenticator(this::createReview, TTL, audiences, ticker);
  }

  @Test
  void whenNoToken_authenticateAsAnonymous() {
    Optional<UserInfo> user = createAuthenticator(List.of()).authenticate(null);

    assertThat(user, equalTo(Optional.of(UserInfo.anonymous())));
    assertThat(requests.size(), equalTo(0));
  }

  @Test
  void whenReviewAuthenticates_returnReviewedUser() {
    Optional<UserInfo> user = createAuthenticator(List.of()).authenticate(TOKEN);

    assertThat(user, equalTo(Optional.of(new UserInfo("jane", "1234", List.of("devs")))));
  }

  @Test
  void reviewRequestContainsToken() {
    createAuthenticator(List.of()).authenticate(TOKEN);

    assertThat(requests.get(0).getKind(), equalTo("TokenReview"));
    assertThat(requests.get(0).getSpec().getToken(), equalTo(TOKEN));
    assertThat(requests.get(0).getSpec().getAudiences(), nullValue());
  }

  @Test
  void whenAudiencesConfigured_reviewRequestContainsThem() {
    createAuthenticator(List.of("api")).authenticate(TOKEN);

    assertThat(requests.get(0).getSpec().getAudiences(), contains("api"));
  }

  @Test
  void whenReviewRejects_returnEmpty() {
    status = new V1TokenReviewStatus().authenticated(false);

    assertThat(createAuthenticator(List.of()).authenticate(TOKEN), equalTo(Optional.empty()));
  }

  @Test
  void withinTtl_reuseCachedResult() {
    TokenReviewAuthenticator authenticator = createAuthenticator(List.of());
    authenticator.authenticate(TOKEN);
    ticker.advance(Duration.ofSeconds(5));
    authenticator.authenticate(TOKEN);

    assertThat(requests.size(), equalTo(1));
  }

  @Test
  void afterTtl_reviewAgain() {
    TokenReviewAuthenticator authenticator = createAuthenticator(List.of());
    authenticator.authenticate(TOKEN);
    ticker.advance(TTL);
    authenticator.authenticate(TOKEN);

    assertThat(requests.size(), equalTo(2));
  }

  @Test
  void whenTtlIsZero_neverCache() {
    TokenReviewAuthenticator authenticator =
          new TokenReviewAuthenticator(this::createReview, Duration.ZERO, List.of(), ticker);
    authenticator.authenticate(TOKEN);
    authenticator.authenticate(TOKEN);

    assertThat(requests.size(), equalTo(2));
  }

  @Test
  void whenReviewFails_logAndReturnEmpty() {
    failure = new ApiException(500, "server error");

    assertThat(createAuthenticator(List.of()).authenticate(TOKEN), equalTo(Optional.empty()));
    assertThat(logRecords, containsSevere(APIEXCEPTION_FROM_TOKEN_REVIEW));
  }

  @Test
  void whenReviewFails_doNotCacheFailure() {
    TokenReviewAuthenticator authenticator = createAuthenticator(List.of());
    failure = new ApiException(500, "server error");
    authenticator.authenticate(TOKEN);
    failure = null;

    assertThat(authenticator.authenticate(TOKEN).map(UserInfo::getName), equalTo(Optional.of("jane")));
    assertThat(logRecords, containsSevere(APIEXCEPTION_FROM_TOKEN_REVIEW));
  }
}
