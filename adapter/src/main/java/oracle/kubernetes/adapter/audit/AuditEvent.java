// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import oracle.kubernetes.adapter.security.RequestAttributes;

/** A record of one completed request. */
public class AuditEvent {

  public static final String STAGE_RESPONSE_COMPLETE = "ResponseComplete";

  private final String auditId;
  private final AuditLevel level;
  private final RequestAttributes attributes;
  private final String sourceIp;
  private final String userAgent;
  private final int responseCode;
  private final Instant requestReceived;
  private final Instant stageTimestamp;

  /**
   * Creates an event for a completed request.
   * @param level the audit level chosen by the policy
   * @param attributes the request attributes
   * @param sourceIp the remote address of the caller
   * @param userAgent the caller's user agent. May be null.
   * @param responseCode the HTTP status returned
   * @param requestReceived when the request arrived
   */
  public AuditEvent(AuditLevel level, RequestAttributes attributes, String sourceIp, String userAgent,
                    int responseCode, Instant requestReceived) {
    this.auditId = UUID.randomUUID().toString();
    this.level = level;
    this.attributes = attributes;
    this.sourceIp = sourceIp;
    this.userAgent = userAgent;
    this.responseCode = responseCode;
    this.requestReceived = requestReceived;
    this.stageTimestamp = Instant.now();
  }

  public String getAuditId() {
    return auditId;
  }

  public AuditLevel getLevel() {
    return level;
  }

  public RequestAttributes getAttributes() {
    return attributes;
  }

  public String getSourceIp() {
    return sourceIp;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public int getResponseCode() {
    return responseCode;
  }

  /**
   * Returns the event in the audit.k8s.io/v1 Event form.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> user = new LinkedHashMap<>();
    user.put("username", attributes.getUser().getName());
    if (attributes.getUser().getUid() != null) {
      user.put("uid", attributes.getUser().getUid());
    }
    user.put("groups", attributes.getUser().getGroups());

    Map<String, Object> event = new LinkedHashMap<>();
    event.put("kind", "Event");
    event.put("apiVersion", "audit.k8s.io/v1");
    event.put("level", level.getValue());
    event.put("auditID", auditId);
    event.put("stage", STAGE_RESPONSE_COMPLETE);
    event.put("requestURI", attributes.getPath());
    event.put("verb", attributes.getVerb());
    event.put("user", user);
    event.put("sourceIPs", List.of(sourceIp));
    if (userAgent != null) {
      event.put("userAgent", userAgent);
    }
    event.put("responseStatus", Map.of("code", responseCode));
    event.put("requestReceivedTimestamp", requestReceived.toString());
    event.put("stageTimestamp", stageTimestamp.toString());
    return event;
  }

  /**
   * Returns the event as a single line of the legacy text format.
   */
  public String toLegacyLine() {
    return String.format("%s AUDIT: id=\"%s\" stage=\"%s\" ip=\"%s\" method=\"%s\" user=\"%s\" groups=\"%s\""
                + " user-agent=\"%s\" uri=\"%s\" response=\"%d\"",
          stageTimestamp, auditId, STAGE_RESPONSE_COMPLETE, sourceIp, attributes.getVerb(),
          attributes.getUser().getName(), String.join(",", attributes.getUser().getGroups()),
          userAgent == null ? "" : userAgent, attributes.getPath(), responseCode);
  }
}
