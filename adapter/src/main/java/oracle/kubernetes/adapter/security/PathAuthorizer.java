// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Allows any request for a listed path, whoever made it. A path ending in {@code *} allows every
 * path which starts with the text before it. Other requests get no opinion.
 */
public class PathAuthorizer implements Authorizer {

  private final Set<String> paths = new HashSet<>();
  private final List<String> prefixes = new ArrayList<>();

  /**
   * Creates the authorizer.
   * @param alwaysAllowPaths the paths to allow
   * @throws IllegalArgumentException if a {@code *} appears anywhere but at the end of a path
   */
  public PathAuthorizer(List<String> alwaysAllowPaths) {
    for (String path : alwaysAllowPaths) {
      String trimmed = path.trim();
      int star = trimmed.indexOf('*');
      if (star >= 0 && star != trimmed.length() - 1) {
        throw new IllegalArgumentException("only trailing * allowed in " + path);
      }
      if (star >= 0) {
        prefixes.add(trimmed.substring(0, star));
      } else {
        paths.add(trimmed);
      }
    }
  }

  @Override
  public Decision authorize(RequestAttributes attributes) {
    String path = attributes.getPath();
    if (paths.contains(path) || prefixes.stream().anyMatch(path::startsWith)) {
      return Decision.ALLOW;
    }
    return Decision.NO_OPINION;
  }
}
