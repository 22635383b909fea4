// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;
import javax.annotation.Priority;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.container.ContainerRequestFilter;
import javax.ws.rs.container.PreMatching;
import javax.ws.rs.core.Application;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.Response.Status;
import javax.ws.rs.ext.Provider;

import oracle.kubernetes.adapter.config.LoopbackClientConfig;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.security.Authenticator;
import oracle.kubernetes.adapter.security.Authorizer;
import oracle.kubernetes.adapter.security.Decision;
import oracle.kubernetes.adapter.security.RequestAttributes;
import oracle.kubernetes.adapter.security.UserInfo;
import oracle.kubernetes.common.logging.LoggingFacade;
import oracle.kubernetes.common.logging.LoggingFactory;
import oracle.kubernetes.common.logging.MessageKeys;
import org.glassfish.jersey.server.ResourceConfig;

/**
 * Authenticates each request from its bearer token and then authorizes it. The attributes of an
 * authorized request are stored as a request property for the filters that follow.
 */
@Provider
@PreMatching
@Priority(FilterPriorities.SECURITY_FILTER_PRIORITY)
public class SecurityFilter implements ContainerRequestFilter {
  private static final LoggingFacade LOGGER = LoggingFactory.getLogger("Adapter", "Adapter");

  public static final String REQUEST_ATTRIBUTES_PROPERTY = "RequestAttributes";
  static final String LOOPBACK_USER = "system:apiserver";
  static final String MASTERS_GROUP = "system:masters";

  private static final String ACCESS_TOKEN_PREFIX = "Bearer ";

  @Context
  private Application application;

  @Override
  public void filter(ContainerRequestContext req) {
    LOGGER.entering();
    ServerConfig config =
          (ServerConfig) ((ResourceConfig) application).getProperty(AdapterServer.SERVER_CONFIG_PROPERTY);
    String path = "/" + req.getUriInfo().getPath();

    UserInfo user = authenticate(config, getAccessToken(req)).orElseThrow(() -> {
      LOGGER.info(MessageKeys.REST_AUTHENTICATION_FAILED, path);
      return failure(Status.UNAUTHORIZED, "Unauthorized");
    });

    RequestAttributes attributes = new RequestAttributes(user, req.getMethod(), path);
    req.setProperty(REQUEST_ATTRIBUTES_PROPERTY, attributes);
    if (authorize(config, attributes) != Decision.ALLOW) {
      LOGGER.info(MessageKeys.REST_AUTHORIZATION_DENIED, user.getName(), attributes.getVerb(), path);
      throw failure(Status.FORBIDDEN, String.format("forbidden: User \"%s\" cannot %s path \"%s\"",
            user.getName(), attributes.getVerb(), path));
    }
    LOGGER.exiting();
  }

  private String getAccessToken(ContainerRequestContext req) {
    String atz = req.getHeaderString(HttpHeaders.AUTHORIZATION);
    if (atz != null && atz.startsWith(ACCESS_TOKEN_PREFIX)) {
      String t = atz.substring(ACCESS_TOKEN_PREFIX.length()).trim();
      if (t.length() > 0) {
        return t;
      }
    }
    return null;
  }

  private Optional<UserInfo> authenticate(ServerConfig config, String token) {
    LoopbackClientConfig loopback = config.getLoopbackClientConfig();
    if (token != null && loopback != null && isLoopbackToken(token, loopback.getBearerToken())) {
      return Optional.of(new UserInfo(LOOPBACK_USER, null, List.of(MASTERS_GROUP)));
    }
    Authenticator authenticator = config.getAuthentication().getAuthenticator();
    return authenticator == null ? Optional.empty() : authenticator.authenticate(token);
  }

  // compared in constant time
  private static boolean isLoopbackToken(String token, String loopbackToken) {
    return loopbackToken != null
          && MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8), loopbackToken.getBytes(StandardCharsets.UTF_8));
  }

  private Decision authorize(ServerConfig config, RequestAttributes attributes) {
    Authorizer authorizer = config.getAuthorization().getAuthorizer();
    return authorizer == null ? Decision.NO_OPINION : authorizer.authorize(attributes);
  }

  private WebApplicationException failure(Status status, String message) {
    WebApplicationException e = new WebApplicationException(
          Response.status(status).type(MediaType.TEXT_PLAIN_TYPE).entity(message).build());
    LOGGER.throwing(e);
    return e;
  }
}
