// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest.resource;

import java.util.Map;
import javax.ws.rs.GET;
import javax.ws.rs.NotFoundException;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

import oracle.kubernetes.adapter.config.OpenApiConfig;
import oracle.kubernetes.adapter.config.OpenApiV3Config;
import oracle.kubernetes.adapter.features.FeatureGates;

/** Publishes the OpenAPI documents attached to the server configuration. */
@Path("openapi")
public class OpenApiResource extends BaseResource {

  /**
   * Returns the OpenAPI v2 document.
   * @throws NotFoundException if no v2 document is configured
   */
  @GET
  @Path("v2")
  @Produces(MediaType.APPLICATION_JSON)
  public Map<String, Object> getV2() {
    OpenApiConfig config = getServerConfig().getOpenApiConfig();
    if (config == null) {
      throw new NotFoundException();
    }
    return config.toDocument();
  }

  /**
   * Returns the OpenAPI v3 document.
   * @throws NotFoundException if no v3 document is configured or the OpenAPIV3 gate is off
   */
  @GET
  @Path("v3")
  @Produces(MediaType.APPLICATION_JSON)
  public Map<String, Object> getV3() {
    OpenApiV3Config config = getServerConfig().getOpenApiV3Config();
    FeatureGates gates = getServerConfig().getFeatureGates();
    if (config == null || (gates != null && !gates.isFeatureEnabled(FeatureGates.OPENAPI_V3))) {
      throw new NotFoundException();
    }
    return config.toDocument();
  }
}
