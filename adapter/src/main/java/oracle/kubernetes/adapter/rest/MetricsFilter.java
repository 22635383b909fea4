// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import javax.annotation.Priority;
import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.container.ContainerResponseContext;
import javax.ws.rs.container.ContainerResponseFilter;
import javax.ws.rs.core.Application;
import javax.ws.rs.core.Context;
import javax.ws.rs.ext.Provider;

import oracle.kubernetes.adapter.security.RequestAttributes;
import org.glassfish.jersey.server.ResourceConfig;

/** Counts every response in the request metrics. */
@Provider
@Priority(FilterPriorities.METRICS_FILTER_PRIORITY)
public class MetricsFilter implements ContainerResponseFilter {

  @Context
  private Application application;

  @Override
  public void filter(ContainerRequestContext req, ContainerResponseContext res) {
    RequestMetrics metrics = (RequestMetrics) ((ResourceConfig) application)
          .getProperty(AdapterServer.REQUEST_METRICS_PROPERTY);
    metrics.recordRequest(RequestAttributes.toVerb(req.getMethod()), res.getStatus());
  }
}
