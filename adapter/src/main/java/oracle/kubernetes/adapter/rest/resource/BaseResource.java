// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest.resource;

import javax.ws.rs.core.Application;
import javax.ws.rs.core.Context;

import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.rest.AdapterServer;
import org.glassfish.jersey.server.ResourceConfig;

/** Gives resources access to the server configuration attached to the application. */
public abstract class BaseResource {

  @Context
  private Application application;

  protected Object getProperty(String name) {
    return ((ResourceConfig) application).getProperty(name);
  }

  protected ServerConfig getServerConfig() {
    return (ServerConfig) getProperty(AdapterServer.SERVER_CONFIG_PROPERTY);
  }
}
