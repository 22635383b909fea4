// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest.resource;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

import oracle.kubernetes.adapter.rest.AdapterServer;
import oracle.kubernetes.adapter.rest.RequestMetrics;

@Path("metrics")
public class MetricsResource extends BaseResource {

  @GET
  @Produces(MediaType.TEXT_PLAIN)
  public String getMetrics() {
    return ((RequestMetrics) getProperty(AdapterServer.REQUEST_METRICS_PROPERTY)).render();
  }
}
