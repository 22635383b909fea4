// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import java.util.LinkedHashMap;
import java.util.Map;

/** Describes the OpenAPI v2 (swagger) document the server publishes. */
public class OpenApiConfig {

  private final String title;
  private final String version;
  private final Map<String, Object> definitions;

  /**
   * Creates an OpenAPI v2 document descriptor.
   * @param title the API title
   * @param version the API version
   * @param definitions schema definitions, keyed by model name
   */
  public OpenApiConfig(String title, String version, Map<String, Object> definitions) {
    this.title = title;
    this.version = version;
    this.definitions = new LinkedHashMap<>(definitions);
  }

  public String getTitle() {
    return title;
  }

  public String getVersion() {
    return version;
  }

  public Map<String, Object> getDefinitions() {
    return definitions;
  }

  /**
   * Returns the swagger document, ready to be serialized as JSON.
   */
  public Map<String, Object> toDocument() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("title", title);
    info.put("version", version);

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("swagger", "2.0");
    document.put("info", info);
    document.put("paths", new LinkedHashMap<>());
    document.put("definitions", definitions);
    return document;
  }
}
