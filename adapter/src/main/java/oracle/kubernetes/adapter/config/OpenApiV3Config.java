// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import java.util.LinkedHashMap;
import java.util.Map;

/** Describes the OpenAPI v3 document the server publishes. */
public class OpenApiV3Config {

  private final String title;
  private final String version;
  private final Map<String, Object> schemas;

  /**
   * Creates an OpenAPI v3 document descriptor.
   * @param title the API title
   * @param version the API version
   * @param schemas component schemas, keyed by model name
   */
  public OpenApiV3Config(String title, String version, Map<String, Object> schemas) {
    this.title = title;
    this.version = version;
    this.schemas = new LinkedHashMap<>(schemas);
  }

  public String getTitle() {
    return title;
  }

  public String getVersion() {
    return version;
  }

  public Map<String, Object> getSchemas() {
    return schemas;
  }

  /**
   * Returns the OpenAPI v3 document, ready to be serialized as JSON.
   */
  public Map<String, Object> toDocument() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("title", title);
    info.put("version", version);

    Map<String, Object> components = new LinkedHashMap<>();
    components.put("schemas", schemas);

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("openapi", "3.0.0");
    document.put("info", info);
    document.put("paths", new LinkedHashMap<>());
    document.put("components", components);
    return document;
  }
}
