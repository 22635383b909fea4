// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest.resource;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

/** Thread dumps for diagnosing a running server. Registered only when profiling is enabled. */
@Path("debug/pprof")
public class ProfilingResource extends BaseResource {

  /**
   * Returns a dump of every live thread. Lock information is included when contention profiling
   * is enabled.
   */
  @GET
  @Path("goroutine")
  @Produces(MediaType.TEXT_PLAIN)
  public String getThreadDump() {
    boolean withLocks = getServerConfig().isEnableContentionProfiling();
    ThreadMXBean threads = ManagementFactory.getThreadMXBean();
    StringBuilder sb = new StringBuilder();
    for (ThreadInfo info : threads.dumpAllThreads(withLocks, withLocks)) {
      sb.append(info);
    }
    return sb.toString();
  }
}
