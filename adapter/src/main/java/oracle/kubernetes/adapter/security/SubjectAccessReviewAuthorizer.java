// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.time.Duration;

import com.github.benmanes.caffeine.cache.Ticker;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.AuthorizationV1Api;
import io.kubernetes.client.openapi.models.V1NonResourceAttributes;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1SubjectAccessReview;
import io.kubernetes.client.openapi.models.V1SubjectAccessReviewSpec;
import io.kubernetes.client.openapi.models.V1SubjectAccessReviewStatus;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;

/** Delegates authorization decisions to Kubernetes ABAC and/or RBAC by creating SubjectAccessReviews. */
public class SubjectAccessReviewAuthorizer implements Authorizer {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  private final ReviewCall<V1SubjectAccessReview> accessReviews;
  private final Duration allowTtl;
  private final Duration denyTtl;
  private final int retryAttempts;
  private final ExpiringCache<RequestAttributes, Decision> cache;

  /**
   * Creates an authorizer which calls the specified API server.
   * @param client a client allowed to create subject access reviews
   * @param allowTtl how long to cache a decision to allow
   * @param denyTtl how long to cache any other decision
   * @param retryAttempts the number of times to try a review before giving up
   */
  public SubjectAccessReviewAuthorizer(ApiClient client, Duration allowTtl, Duration denyTtl, int retryAttempts) {
    this(body -> new AuthorizationV1Api(client).createSubjectAccessReview(body, null, null, null, null),
          allowTtl, denyTtl, retryAttempts, Ticker.systemTicker());
  }

  SubjectAccessReviewAuthorizer(ReviewCall<V1SubjectAccessReview> accessReviews, Duration allowTtl,
                                Duration denyTtl, int retryAttempts, Ticker ticker) {
    this.accessReviews = accessReviews;
    this.allowTtl = allowTtl;
    this.denyTtl = denyTtl;
    this.retryAttempts = Math.max(1, retryAttempts);
    this.cache = new ExpiringCache<>(ExpiringCache.DEFAULT_MAXIMUM_SIZE, ticker);
  }

  @Override
  public Decision authorize(RequestAttributes attributes) {
    LOGGER.entering();
    Decision cached = cache.get(attributes).orElse(null);
    if (cached != null) {
      LOGGER.exiting(cached);
      return cached;
    }

    V1SubjectAccessReview result;
    try {
      result = createWithRetries(prepareSubjectAccessReview(attributes));
    } catch (ApiException e) {
      LOGGER.severe(MessageKeys.APIEXCEPTION_FROM_SUBJECT_ACCESS_REVIEW, e);
      LOGGER.exiting(Decision.NO_OPINION);
      return Decision.NO_OPINION;
    }

    Decision decision = toDecision(result.getStatus());
    cache.put(attributes, decision, decision == Decision.ALLOW ? allowTtl : denyTtl);
    LOGGER.exiting(decision);
    return decision;
  }

  private V1SubjectAccessReview createWithRetries(V1SubjectAccessReview review) throws ApiException {
    for (int attempt = 1; ; attempt++) {
      try {
        return accessReviews.create(review);
      } catch (ApiException e) {
        if (attempt >= retryAttempts || !isRetryable(e)) {
          throw e;
        }
        LOGGER.fine(MessageKeys.APIEXCEPTION_FROM_SUBJECT_ACCESS_REVIEW, e);
      }
    }
  }

  // connection failures report a zero status code
  private boolean isRetryable(ApiException e) {
    return e.getCode() == 0 || e.getCode() == 429 || e.getCode() >= 500;
  }

  private Decision toDecision(V1SubjectAccessReviewStatus status) {
    if (status == null) {
      return Decision.NO_OPINION;
    } else if (Boolean.TRUE.equals(status.getAllowed())) {
      return Decision.ALLOW;
    } else if (Boolean.TRUE.equals(status.getDenied())) {
      return Decision.DENY;
    } else {
      return Decision.NO_OPINION;
    }
  }

  private V1SubjectAccessReview prepareSubjectAccessReview(RequestAttributes attributes) {
    UserInfo user = attributes.getUser();
    V1SubjectAccessReviewSpec spec = new V1SubjectAccessReviewSpec()
          .user(user.getName())
          .uid(user.getUid())
          .groups(user.getGroups())
          .nonResourceAttributes(new V1NonResourceAttributes().path(attributes.getPath()).verb(attributes.getVerb()));

    return new V1SubjectAccessReview()
          .apiVersion("authorization.k8s.io/v1")
          .kind("SubjectAccessReview")
          .metadata(new V1ObjectMeta())
          .spec(spec);
  }
}
