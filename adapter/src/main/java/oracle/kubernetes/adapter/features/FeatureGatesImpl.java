// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;

/**
 * Feature gates parsed from a comma-separated list of {@code Name=true|false} pairs. Gates not
 * named in the list keep their defaults.
 */
public class FeatureGatesImpl implements FeatureGates {

  private static final Map<String, Boolean> KNOWN_FEATURES = new LinkedHashMap<>();

  static {
    KNOWN_FEATURES.put(API_PRIORITY_AND_FAIRNESS, true);
    KNOWN_FEATURES.put(API_RESPONSE_COMPRESSION, false);
    KNOWN_FEATURES.put(OPENAPI_V3, true);
  }

  private final Map<String, Boolean> features = new LinkedHashMap<>(KNOWN_FEATURES);

  /**
   * Creates the gates from a settings string.
   * @param settings a list such as "APIPriorityAndFairness=false,OpenAPIV3=true". Entries that
   *     are malformed or name unknown gates are ignored; use {@link #validate(String)} to report them.
   */
  public FeatureGatesImpl(String settings) {
    for (String entry : getEntries(settings)) {
      String name = getFeatureName(entry);
      if (KNOWN_FEATURES.containsKey(name) && hasBooleanValue(entry)) {
        features.put(name, isEnabledFeatureName(entry));
      }
    }
  }

  /**
   * Checks feature gate settings.
   * @param settings a comma-separated list of Name=true|false pairs
   * @return a description of each problem found; empty if the settings are valid
   */
  public static List<String> validate(String settings) {
    List<String> errors = new ArrayList<>();
    for (String entry : getEntries(settings)) {
      if (!entry.contains("=")) {
        errors.add("missing bool value for feature gate " + entry);
      } else if (!KNOWN_FEATURES.containsKey(getFeatureName(entry))) {
        errors.add("unrecognized feature gate: " + getFeatureName(entry));
      } else if (!hasBooleanValue(entry)) {
        errors.add("invalid value of " + entry + ", must be true or false");
      }
    }
    return errors;
  }

  public static Collection<String> getKnownFeatures() {
    return Collections.unmodifiableSet(KNOWN_FEATURES.keySet());
  }

  @Nonnull
  private static List<String> getEntries(String settings) {
    if (settings == null || settings.isBlank()) {
      return Collections.emptyList();
    }
    return Arrays.stream(settings.split(","))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .collect(Collectors.toList());
  }

  private static boolean isEnabledFeatureName(String v) {
    return "true".equalsIgnoreCase(getFeatureValue(v));
  }

  private static boolean hasBooleanValue(String v) {
    String value = getFeatureValue(v);
    return "true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value);
  }

  private static String getFeatureName(String v) {
    return v.split("=", 2)[0].trim();
  }

  private static String getFeatureValue(String v) {
    String[] parts = v.split("=", 2);
    return parts.length < 2 ? "" : parts[1].trim();
  }

  @Override
  public Collection<String> getEnabledFeatures() {
    return features.entrySet().stream()
          .filter(Map.Entry::getValue)
          .map(Map.Entry::getKey)
          .collect(Collectors.toList());
  }

  @Override
  public boolean isFeatureEnabled(String featureName) {
    return features.getOrDefault(featureName, false);
  }

  @Override
  public String toString() {
    return features.entrySet().stream()
          .map(e -> e.getKey() + "=" + e.getValue())
          .collect(Collectors.joining(","));
  }
}
