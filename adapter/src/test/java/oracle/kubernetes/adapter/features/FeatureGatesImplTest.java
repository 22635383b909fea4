// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.features;

import org.junit.jupiter.api.Test;

import static oracle.kubernetes.adapter.features.FeatureGates.API_PRIORITY_AND_FAIRNESS;
import static oracle.kubernetes.adapter.features.FeatureGates.API_RESPONSE_COMPRESSION;
import static oracle.kubernetes.adapter.features.FeatureGates.OPENAPI_V3;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

class FeatureGatesImplTest {

  @Test
  void whenSettingsEmpty_useDefaults() {
    FeatureGates gates = new FeatureGatesImpl("");

    assertThat(gates.getEnabledFeatures(), containsInAnyOrder(API_PRIORITY_AND_FAIRNESS, OPENAPI_V3));
  }

  @Test
  void namedGates_overrideDefaults() {
    FeatureGates gates = new FeatureGatesImpl("APIPriorityAndFairness=false, APIResponseCompression=true");

    assertThat(gates.isFeatureEnabled(API_PRIORITY_AND_FAIRNESS), is(false));
    assertThat(gates.isFeatureEnabled(API_RESPONSE_COMPRESSION), is(true));
    assertThat(gates.isFeatureEnabled(OPENAPI_V3), is(true));
  }

  @Test
  void unknownGate_isNotEnabled() {
    assertThat(new FeatureGatesImpl("Other=true").isFeatureEnabled("Other"), is(false));
  }

  @Test
  void toString_listsEveryKnownGate() {
    assertThat(new FeatureGatesImpl("OpenAPIV3=false").toString(),
          equalTo("APIPriorityAndFairness=true,APIResponseCompression=false,OpenAPIV3=false"));
  }

  @Test
  void validSettings_hasNoErrors() {
    assertThat(FeatureGatesImpl.validate("OpenAPIV3=false,APIResponseCompression=true"), empty());
  }

  @Test
  void valuesWithSpacesOrCapitals_areAccepted() {
    FeatureGatesImpl gates = new FeatureGatesImpl("APIResponseCompression = true, OpenAPIV3=FALSE");

    assertThat(gates.isFeatureEnabled(API_RESPONSE_COMPRESSION), is(true));
    assertThat(gates.isFeatureEnabled(OPENAPI_V3), is(false));
    assertThat(FeatureGatesImpl.validate("APIResponseCompression = true, OpenAPIV3=FALSE"), empty());
  }

  @Test
  void whenValueMissing_reportError() {
    assertThat(FeatureGatesImpl.validate("OpenAPIV3"), contains("missing bool value for feature gate OpenAPIV3"));
  }

  @Test
  void whenGateUnknown_reportError() {
    assertThat(FeatureGatesImpl.validate("Other=true"), contains("unrecognized feature gate: Other"));
  }

  @Test
  void whenValueNotBoolean_reportError() {
    assertThat(FeatureGatesImpl.validate("OpenAPIV3=maybe"),
          contains("invalid value of OpenAPIV3=maybe, must be true or false"));
  }
}
