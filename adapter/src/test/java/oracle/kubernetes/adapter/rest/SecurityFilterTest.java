// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.rest;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.LogRecord;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.UriInfo;

import com.meterware.simplestub.Memento;
import oracle.kubernetes.adapter.config.LoopbackClientConfig;
import oracle.kubernetes.adapter.config.ServerConfig;
import oracle.kubernetes.adapter.security.Authenticator;
import oracle.kubernetes.adapter.security.PrivilegedGroupAuthorizer;
import oracle.kubernetes.adapter.security.RequestAttributes;
import oracle.kubernetes.adapter.security.UserInfo;
import org.glassfish.jersey.server.ResourceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.meterware.simplestub.Stub.createStub;
import static oracle.kubernetes.common.logging.MessageKeys.REST_AUTHENTICATION_FAILED;
import static oracle.kubernetes.common.logging.MessageKeys.REST_AUTHORIZATION_DENIED;
import static oracle.kubernetes.utils.LogMatcher.containsInfo;
import static oracle.kubernetes.utils.TestUtils.silenceAdapterLogger;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SecurityFilterTest {

  private static final String LOOPBACK_TOKEN = "loopback-token";
  private static final String USER_TOKEN = "user-token";

  private final List<Memento> mementos = new ArrayList<>();
  private final Collection<LogRecord> logRecords = new ArrayList<>();
  private final ServerConfig serverConfig = new ServerConfig();
  private final SecurityFilter filter = new SecurityFilter();

  @BeforeEach
  void setUp() throws Exception {
    mementos.add(silenceAdapterLogger()
          .collectLogMessages(logRecords, REST_AUTHENTICATION_FAILED, REST_AUTHORIZATION_DENIED));

    Field application = SecurityFilter.class.getDeclaredField("application");
    application.setAccessible(true);
    application.set(filter, new ResourceConfig().property(AdapterServer.SERVER_CONFIG_PROPERTY, serverConfig));
  }

  @AfterEach
  void tearDown() {
    mementos.forEach(Memento::revert);
  }

  private RequestContextStub createRequest(String method, String path, String authorization) {
    RequestContextStub request = createStub(RequestContextStub.class, method, createStub(UriInfoStub.class, path));
    if (authorization != null) {
      request.headers.put(HttpHeaders.AUTHORIZATION, authorization);
    }
    return request;
  }

  private int getFailureStatus(ContainerRequestContext request) {
    return assertThrows(WebApplicationException.class, () -> filter.filter(request)).getResponse().getStatus();
  }

  private static Authenticator acceptingToken(String token, UserInfo user) {
    return t -> token.equals(t) ? Optional.of(user) : Optional.empty();
  }

  @Test
  void whenNoAuthenticatorConfigured_rejectUnauthorized() {
    assertThat(getFailureStatus(createRequest("GET", "metrics", null)), equalTo(401));
    assertThat(logRecords, containsInfo(REST_AUTHENTICATION_FAILED).withParams("/metrics"));
  }

  @Test
  void whenTokenRejected_rejectUnauthorized() {
    serverConfig.getAuthentication().setAuthenticator(Authenticator.anonymousOnly());

    assertThat(getFailureStatus(createRequest("GET", "metrics", "Bearer bad")), equalTo(401));
    assertThat(logRecords, containsInfo(REST_AUTHENTICATION_FAILED));
  }

  @Test
  void whenAuthenticatedButNotAuthorized_rejectForbidden() {
    serverConfig.getAuthentication().setAuthenticator(Authenticator.anonymousOnly());
    RequestContextStub request = createRequest("GET", "metrics", null);

    WebApplicationException e = assertThrows(WebApplicationException.class, () -> filter.filter(request));

    assertThat(e.getResponse().getStatus(), equalTo(403));
    assertThat(e.getResponse().getEntity(),
          equalTo("forbidden: User \"system:anonymous\" cannot get path \"/metrics\""));
    assertThat(logRecords, containsInfo(REST_AUTHORIZATION_DENIED).withParams(UserInfo.ANONYMOUS_USER, "get"));
  }

  @Test
  void whenNonBearerAuthorization_treatAsAnonymous() {
    serverConfig.getAuthentication().setAuthenticator(Authenticator.anonymousOnly());
    serverConfig.getAuthorization().setAuthorizer(
          new PrivilegedGroupAuthorizer(List.of(UserInfo.UNAUTHENTICATED_GROUP)));
    RequestContextStub request = createRequest("GET", "healthz", "Basic dXNlcjpwYXNz");

    filter.filter(request);

    assertThat(getAttributes(request).getUser(), equalTo(UserInfo.anonymous()));
  }

  private RequestAttributes getAttributes(RequestContextStub request) {
    return (RequestAttributes) request.getProperty(SecurityFilter.REQUEST_ATTRIBUTES_PROPERTY);
  }

  @Test
  void whenAuthorized_recordRequestAttributes() {
    UserInfo user = new UserInfo("jane", "42", List.of("ops"));
    serverConfig.getAuthentication().setAuthenticator(acceptingToken(USER_TOKEN, user));
    serverConfig.getAuthorization().setAuthorizer(new PrivilegedGroupAuthorizer(List.of("ops")));
    RequestContextStub request = createRequest("POST", "metrics", "Bearer " + USER_TOKEN);

    filter.filter(request);

    assertThat(getAttributes(request), equalTo(new RequestAttributes(user, "POST", "/metrics")));
  }

  @Test
  void whenLoopbackTokenPresented_authenticateAsPrivilegedUser() {
    serverConfig.setLoopbackClientConfig(new LoopbackClientConfig("https://localhost:6443", LOOPBACK_TOKEN, null));
    serverConfig.getAuthorization().setAuthorizer(
          new PrivilegedGroupAuthorizer(List.of(SecurityFilter.MASTERS_GROUP)));
    RequestContextStub request = createRequest("GET", "openapi/v2", "Bearer " + LOOPBACK_TOKEN);

    filter.filter(request);

    assertThat(getAttributes(request).getUser().getName(), equalTo(SecurityFilter.LOOPBACK_USER));
  }

  @Test
  void whenTokenOnlyResemblesLoopbackToken_rejectUnauthorized() {
    serverConfig.setLoopbackClientConfig(new LoopbackClientConfig("https://localhost:6443", LOOPBACK_TOKEN, null));
    serverConfig.getAuthorization().setAuthorizer(
          new PrivilegedGroupAuthorizer(List.of(SecurityFilter.MASTERS_GROUP)));

    assertThat(getFailureStatus(createRequest("GET", "openapi/v2", "Bearer loopback-toke")), equalTo(401));
    assertThat(getFailureStatus(createRequest("GET", "openapi/v2", "Bearer loopback-tokem")), equalTo(401));
    logRecords.clear();
  }

  @Test
  void whenRequestRejected_recordNoAttributes() {
    RequestContextStub request = createRequest("GET", "metrics", "Bearer " + USER_TOKEN);

    getFailureStatus(request);

    assertThat(getAttributes(request), nullValue());
    logRecords.clear();
  }

  abstract static class RequestContextStub implements ContainerRequestContext {
    private final String method;
    private final UriInfo uriInfo;
    private final Map<String, String> headers = new HashMap<>();
    private final Map<String, Object> properties = new HashMap<>();

    RequestContextStub(String method, UriInfo uriInfo) {
      this.method = method;
      this.uriInfo = uriInfo;
    }

    @Override
    public String getMethod() {
      return method;
    }

    @Override
    public UriInfo getUriInfo() {
      return uriInfo;
    }

    @Override
    public String getHeaderString(String name) {
      return headers.get(name);
    }

    @Override
    public Object getProperty(String name) {
      return properties.get(name);
    }

    @Override
    public void setProperty(String name, Object object) {
      properties.put(name, object);
    }
  }

  abstract static class UriInfoStub implements UriInfo {
    private final String path;

    UriInfoStub(String path) {
      this.path = path;
    }

    @Override
    public String getPath() {
      return path;
    }
  }
}
