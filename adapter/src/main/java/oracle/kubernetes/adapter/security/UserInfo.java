// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** An authenticated (or anonymous) caller. */
public class UserInfo {

  public static final String ANONYMOUS_USER = "system:anonymous";
  public static final String UNAUTHENTICATED_GROUP = "system:unauthenticated";

  private final String name;
  private final String uid;
  private final List<String> groups;

  /**
   * Creates a user description.
   * @param name the user name
   * @param uid a unique id for the user. May be null.
   * @param groups the groups the user belongs to
   */
  public UserInfo(String name, String uid, List<String> groups) {
    this.name = name;
    this.uid = uid;
    this.groups = groups == null ? Collections.emptyList() : List.copyOf(groups);
  }

  public static UserInfo anonymous() {
    return new UserInfo(ANONYMOUS_USER, null, List.of(UNAUTHENTICATED_GROUP));
  }

  public String getName() {
    return name;
  }

  public String getUid() {
    return uid;
  }

  public List<String> getGroups() {
    return groups;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UserInfo)) {
      return false;
    }
    UserInfo other = (UserInfo) o;
    return Objects.equals(name, other.name) && Objects.equals(uid, other.uid) && groups.equals(other.groups);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, uid, groups);
  }

  @Override
  public String toString() {
    return name;
  }
}
