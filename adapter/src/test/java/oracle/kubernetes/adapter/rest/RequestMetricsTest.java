// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThan;

class RequestMetricsTest {

  private final RequestMetrics metrics = new RequestMetrics();

  @Test
  void countRequestsByVerbAndCode() {
    metrics.recordRequest("get", 200);
    metrics.recordRequest("get", 200);
    metrics.recordRequest("get", 403);

    assertThat(metrics.getCount("get", 200), equalTo(2L));
    assertThat(metrics.getCount("get", 403), equalTo(1L));
    assertThat(metrics.getCount("create", 200), equalTo(0L));
  }

  @Test
  void render_includesHelpAndType() {
    String text = metrics.render();

    assertThat(text, containsString("# HELP apiserver_request_total "));
    assertThat(text, containsString("# TYPE apiserver_request_total counter\n"));
  }

  @Test
  void render_listsSeriesInLabelOrder() {
    metrics.recordRequest("get", 401);
    metrics.recordRequest("get", 200);

    String text = metrics.render();

    assertThat(text, containsString("apiserver_request_total{code=\"200\",verb=\"get\"} 1\n"));
    assertThat(text.indexOf("code=\"200\""), lessThan(text.indexOf("code=\"401\"")));
  }
}
