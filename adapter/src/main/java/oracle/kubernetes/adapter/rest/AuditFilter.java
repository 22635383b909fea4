// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import java.time.Instant;
import java.util.Optional;
import javax.annotation.Priority;
import javax.inject.Inject;
import javax.inject.Provider;
import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.container.ContainerRequestFilter;
import javax.ws.rs.container.ContainerResponseContext;
import javax.ws.rs.container.ContainerResponseFilter;
import javax.ws.rs.container.PreMatching;
import javax.ws.rs.core.Application;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.HttpHeaders;

import oracle.kubernetes.adapter.audit.AuditBackend;
import oracle.kubernetes.adapter.audit.AuditEvent;
import oracle.kubernetes.adapter.audit.AuditLevel;
import oracle.kubernetes.adapter.audit.AuditPolicy;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.security.RequestAttributes;
import oracle.kubernetes.adapter.security.UserInfo;
import org.glassfish.grizzly.http.server.Request;
import org.glassfish.jersey.server.ResourceConfig;

/** Records an audit event for each completed request that the audit policy selects. */
@javax.ws.rs.ext.Provider
@PreMatching
@Priority(FilterPriorities.AUDIT_FILTER_PRIORITY)
public class AuditFilter implements ContainerRequestFilter, ContainerResponseFilter {

  static final String REQUEST_RECEIVED_PROPERTY = "RequestReceived";

  @Context
  private Application application;

  @Inject
  private Provider<Request> grizzlyRequest;

  @Override
  public void filter(ContainerRequestContext req) {
    req.setProperty(REQUEST_RECEIVED_PROPERTY, Instant.now());
  }

  @Override
  public void filter(ContainerRequestContext req, ContainerResponseContext res) {
    ServerConfig config =
          (ServerConfig) ((ResourceConfig) application).getProperty(AdapterServer.SERVER_CONFIG_PROPERTY);
    AuditBackend backend = config.getAuditBackend();
    AuditPolicy policy = config.getAuditPolicy();
    if (backend == null || policy == null) {
      return;
    }

    RequestAttributes attributes = Optional.ofNullable(
          (RequestAttributes) req.getProperty(SecurityFilter.REQUEST_ATTRIBUTES_PROPERTY))
          .orElseGet(() -> new RequestAttributes(UserInfo.anonymous(), req.getMethod(), getRequestPath(req)));
    AuditLevel level = policy.levelFor(attributes);
    if (level == AuditLevel.NONE || policy.isStageOmitted(attributes, AuditEvent.STAGE_RESPONSE_COMPLETE)) {
      return;
    }

    Instant received = Optional.ofNullable((Instant) req.getProperty(REQUEST_RECEIVED_PROPERTY)).orElse(Instant.now());
    backend.processEvent(new AuditEvent(level, attributes, getSourceIp(),
          req.getHeaderString(HttpHeaders.USER_AGENT), res.getStatus(), received));
  }

  // UriInfo paths are relative to the application root
  private static String getRequestPath(ContainerRequestContext req) {
    return "/" + req.getUriInfo().getPath();
  }

  private String getSourceIp() {
    return Optional.ofNullable(grizzlyRequest).map(Provider::get).map(Request::getRemoteAddr).orElse("");
  }
}
