// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.audit;

import java.io.Closeable;

/** A sink for audit events. */
public interface AuditBackend extends Closeable {

  void processEvent(AuditEvent event);
}
