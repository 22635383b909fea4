// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import javax.annotation.Priority;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.container.ContainerRequestFilter;
import javax.ws.rs.container.ContainerResponseContext;
import javax.ws.rs.container.ContainerResponseFilter;
import javax.ws.rs.container.PreMatching;
import javax.ws.rs.core.Application;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.Response.Status;
import javax.ws.rs.ext.Provider;

import oracle.kubernetes.adapter.config.FlowControl;
import oracle.kubernetes.adapter.config.ServerConfig;
import org.glassfish.jersey.server.ResourceConfig;

/** Rejects requests with 429 while every flow control seat is taken. */
@Provider
@PreMatching
@Priority(FilterPriorities.FLOW_CONTROL_FILTER_PRIORITY)
public class FlowControlFilter implements ContainerRequestFilter, ContainerResponseFilter {

  static final String SEAT_PROPERTY = "FlowControlSeat";

  @Context
  private Application application;

  private FlowControl getFlowControl() {
    return ((ServerConfig) ((ResourceConfig) application).getProperty(AdapterServer.SERVER_CONFIG_PROPERTY))
          .getFlowControl();
  }

  @Override
  public void filter(ContainerRequestContext req) {
    FlowControl flowControl = getFlowControl();
    if (flowControl == null) {
      return;
    }
    if (!flowControl.tryAcquire()) {
      throw new WebApplicationException(Response.status(Status.TOO_MANY_REQUESTS)
            .header("Retry-After", "1")
            .type(MediaType.TEXT_PLAIN_TYPE)
            .entity("Too many requests, please try again later.")
            .build());
    }
    req.setProperty(SEAT_PROPERTY, Boolean.TRUE);
  }

  @Override
  public void filter(ContainerRequestContext req, ContainerResponseContext res) {
    if (req.getProperty(SEAT_PROPERTY) != null) {
      req.removeProperty(SEAT_PROPERTY);
      getFlowControl().release();
    }
  }
}
