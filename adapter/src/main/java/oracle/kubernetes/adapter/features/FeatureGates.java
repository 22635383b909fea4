// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.features;

import java.util.Collection;

public interface FeatureGates {

  String API_PRIORITY_AND_FAIRNESS = "APIPriorityAndFairness";
  String API_RESPONSE_COMPRESSION = "APIResponseCompression";
  String OPENAPI_V3 = "OpenAPIV3";

  /**
   * Returns a collection of strings describing the enabled features.
   */
  Collection<String> getEnabledFeatures();

  /**
   * Returns true if the specified feature is enabled.
   * @param featureName the name of a feature
   */
  boolean isFeatureEnabled(String featureName);
}
