// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest.resource;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import oracle.kubernetes.adapter.config.FlowControl;

/** Liveness and readiness probes. */
@Path("/")
public class HealthResource extends BaseResource {

  static final String OK = "ok";

  @GET
  @Path("healthz")
  @Produces(MediaType.TEXT_PLAIN)
  public String healthz() {
    return OK;
  }

  @GET
  @Path("livez")
  @Produces(MediaType.TEXT_PLAIN)
  public String livez() {
    return OK;
  }

  /**
   * Reports ready once the flow control configuration, if any, has been read from the cluster.
   */
  @GET
  @Path("readyz")
  @Produces(MediaType.TEXT_PLAIN)
  public Response readyz() {
    FlowControl flowControl = getServerConfig().getFlowControl();
    if (flowControl != null && !flowControl.hasSynced()) {
      return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .entity("[-]poststarthook/apiserver-flowcontrol failed: not finished")
            .build();
    }
    return Response.ok(OK).build();
  }
}
