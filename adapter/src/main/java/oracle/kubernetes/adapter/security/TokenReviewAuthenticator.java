// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Ticker;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.AuthenticationV1Api;
import io.kubernetes.client.openapi.models.V1TokenReview;
import io.kubernetes.client.openapi.models.V1TokenReviewSpec;
import io.kubernetes.client.openapi.models.V1TokenReviewStatus;
import io.kubernetes.client.openapi.models.V1UserInfo;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Delegates authentication decisions to Kubernetes by creating TokenReviews. Requests without a
 * token are treated as anonymous. Review results are cached for a time to live, keyed by a hash of
 * the token.
 */
public class TokenReviewAuthenticator implements Authenticator {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  private final ReviewCall<V1TokenReview> tokenReviews;
  private final Duration cacheTtl;
  private final List<String> audiences;
  private final ExpiringCache<String, Optional<UserInfo>> cache;

  /**
   * Creates an authenticator which calls the specified API server.
   * @param client a client allowed to create token reviews
   * @param cacheTtl how long to cache review results
   * @param audiences the audiences the token must be valid for. Empty to accept the server's default.
   */
  public TokenReviewAuthenticator(ApiClient client, Duration cacheTtl, List<String> audiences) {
    this(body -> new AuthenticationV1Api(client).createTokenReview(body, null, null, null, null),
          cacheTtl, audiences, Ticker.systemTicker());
  }

  TokenReviewAuthenticator(ReviewCall<V1TokenReview> tokenReviews, Duration cacheTtl, List<String> audiences,
                           Ticker ticker) {
    this.tokenReviews = tokenReviews;
    this.cacheTtl = cacheTtl;
    this.audiences = List.copyOf(audiences);
    this.cache = new ExpiringCache<>(ExpiringCache.DEFAULT_MAXIMUM_SIZE, ticker);
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public List<String> getAudiences() {
    return audiences;
  }

  @Override
  public Optional<UserInfo> authenticate(String token) {
    if (token == null || token.isEmpty()) {
      return Optional.of(UserInfo.anonymous());
    }

    LOGGER.entering(); // Don't expose the token since it's a credential
    String key = DigestUtils.sha256Hex(token);
    Optional<Optional<UserInfo>> cached = cache.get(key);
    if (cached.isPresent()) {
      LOGGER.exiting(cached.get());
      return cached.get();
    }

    V1TokenReview result;
    try {
      result = tokenReviews.create(prepareTokenReview(token));
    } catch (ApiException e) {
      LOGGER.severe(MessageKeys.APIEXCEPTION_FROM_TOKEN_REVIEW, e);
      LOGGER.exiting(null);
      return Optional.empty();
    }

    Optional<UserInfo> user = toUserInfo(result.getStatus());
    cache.put(key, user, cacheTtl);
    LOGGER.exiting(user);
    return user;
  }

  private V1TokenReview prepareTokenReview(String token) {
    V1TokenReviewSpec spec = new V1TokenReviewSpec().token(token);
    if (!audiences.isEmpty()) {
      spec.audiences(audiences);
    }
    return new V1TokenReview().apiVersion("authentication.k8s.io/v1").kind("TokenReview").spec(spec);
  }

  private Optional<UserInfo> toUserInfo(V1TokenReviewStatus status) {
    if (status == null || !Boolean.TRUE.equals(status.getAuthenticated()) || status.getUser() == null) {
      return Optional.empty();
    }
    V1UserInfo user = status.getUser();
    return Optional.of(new UserInfo(user.getUsername(), user.getUid(), user.getGroups()));
  }
}
