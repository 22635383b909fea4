// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/** Counts completed requests by verb and status code, and renders them in Prometheus text format. */
public class RequestMetrics {

  static final String REQUEST_TOTAL = "apiserver_request_total";

  private final Map<String, LongAdder> requestCounts = new ConcurrentHashMap<>();

  public void recordRequest(String verb, int code) {
    requestCounts.computeIfAbsent(labels(verb, code), k -> new LongAdder()).increment();
  }

  private String labels(String verb, int code) {
    return "code=\"" + code + "\",verb=\"" + verb + "\"";
  }

  public long getCount(String verb, int code) {
    LongAdder adder = requestCounts.get(labels(verb, code));
    return adder == null ? 0 : adder.sum();
  }

  /**
   * Returns the metrics in the Prometheus text exposition format.
   */
  public String render() {
    StringBuilder sb = new StringBuilder()
          .append("# HELP ").append(REQUEST_TOTAL)
          .append(" Counter of apiserver requests broken out by verb and code.\n")
          .append("# TYPE ").append(REQUEST_TOTAL).append(" counter\n");
    new TreeMap<>(requestCounts).forEach((labels, count) ->
          sb.append(REQUEST_TOTAL).append('{').append(labels).append("} ").append(count.sum()).append('\n'));
    return sb.toString();
  }
}
