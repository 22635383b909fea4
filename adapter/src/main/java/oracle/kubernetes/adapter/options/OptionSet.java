// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.util.List;

/** A group of related command-line options for one server concern. */
public interface OptionSet {

  /**
   * Checks the options for consistency. Has no side effects.
   * @return a description of every problem found; empty if the options are valid
   */
  List<String> validate();

  /**
   * Registers the command-line flags which set these options.
   * @param flags the flag set to add to
   */
  void addFlags(FlagSet flags);
}
