// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.ws.rs.container.ContainerResponseContext;

import oracle.kubernetes.adapter.audit.AuditBackend;
import oracle.kubernetes.adapter.audit.AuditEvent;
import oracle.kubernetes.adapter.audit.AuditLevel;
import oracle.kubernetes.adapter.audit.AuditPolicy;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.security.RequestAttributes;
import oracle.kubernetes.adapter.security.UserInfo;
import org.apache.commons.io.FileUtils;
import org.glassfish.jersey.server.ResourceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.meterware.simplestub.Stub.createStub;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

class AuditFilterTest {

  private final ServerConfig serverConfig = new ServerConfig();
  private final AuditFilter filter = new AuditFilter();
  private final List<AuditEvent> events = new ArrayList<>();

  @TempDir
  Path tempDir;

  @BeforeEach
  void setUp() throws Exception {
    Field application = AuditFilter.class.getDeclaredField("application");
    application.setAccessible(true);
    application.set(filter, new ResourceConfig().property(AdapterServer.SERVER_CONFIG_PROPERTY, serverConfig));

    serverConfig.setAuditBackend(new RecordingBackend());
  }

  private void usePolicy(String contents) throws IOException {
    File file = tempDir.resolve("policy.yaml").toFile();
    FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
    serverConfig.setAuditPolicy(AuditPolicy.load(file));
  }

  private SecurityFilterTest.RequestContextStub createRequest(String method, String path) {
    return createStub(SecurityFilterTest.RequestContextStub.class, method,
          createStub(SecurityFilterTest.UriInfoStub.class, path));
  }

  private void completeRequest(SecurityFilterTest.RequestContextStub request, int status) {
    filter.filter(request);
    filter.filter(request, createStub(ResponseContextStub.class, status));
  }

  @Test
  void whenRequestNotAuthenticated_matchRulesAgainstAbsolutePath() throws IOException {
    usePolicy("kind: Policy\nrules:\n"
          + "  - level: None\n    nonResourceURLs: [\"/healthz\"]\n"
          + "  - level: Metadata\n");

    completeRequest(createRequest("GET", "healthz"), 200);
    completeRequest(createRequest("GET", "metrics"), 401);

    assertThat(events, hasSize(1));
    assertThat(events.get(0).getAttributes(),
          equalTo(new RequestAttributes(UserInfo.anonymous(), "GET", "/metrics")));
    assertThat(events.get(0).getResponseCode(), equalTo(401));
  }

  @Test
  void whenRequestAuthenticated_useRecordedAttributes() throws IOException {
    usePolicy("kind: Policy\nrules:\n  - level: Request\n    users: [\"jane\"]\n");
    UserInfo user = new UserInfo("jane", "42", List.of("ops"));
    SecurityFilterTest.RequestContextStub request = createRequest("POST", "metrics");
    request.setProperty(SecurityFilter.REQUEST_ATTRIBUTES_PROPERTY, new RequestAttributes(user, "POST", "/metrics"));

    completeRequest(request, 201);

    assertThat(events, hasSize(1));
    assertThat(events.get(0).getLevel(), equalTo(AuditLevel.REQUEST));
  }

  @Test
  void whenMatchingRuleOmitsResponseComplete_recordNothing() throws IOException {
    usePolicy("kind: Policy\nrules:\n  - level: Metadata\n    omitStages: [\"ResponseComplete\"]\n");

    completeRequest(createRequest("GET", "metrics"), 200);

    assertThat(events, empty());
  }

  @Test
  void whenNoPolicy_recordNothing() {
    completeRequest(createRequest("GET", "metrics"), 200);

    assertThat(events, empty());
  }

  class RecordingBackend implements AuditBackend {
    @Override
    public void processEvent(AuditEvent event) {
      events.add(event);
    }

    @Override
    public void close() {
      // nothing to release
    }
  }

  abstract static class ResponseContextStub implements ContainerResponseContext {
    private final int status;

    ResponseContextStub(int status) {
      this.status = status;
    }

    @Override
    public int getStatus() {
      return status;
    }
  }
}
