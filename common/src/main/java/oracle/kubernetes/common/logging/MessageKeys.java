// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.common.logging;

/**
 * Message keys used to look up log messages from the resource bundle. The use of message keys makes
 * the code more readable.
 */
public class MessageKeys {
  public static final String ADAPTER_STARTED = "CMA-0001";
  public static final String ADAPTER_SHUTTING_DOWN = "CMA-0002";
  public static final String EXCEPTION = "CMA-0003";
  public static final String INVALID_OPTION = "CMA-0004";
  public static final String APPLY_FAILED = "CMA-0005";
  public static final String EXTERNAL_CLIENT_CONFIG = "CMA-0006";
  public static final String GENERATED_SELF_SIGNED_CERT = "CMA-0007";
  public static final String USING_EXISTING_CERT = "CMA-0008";
  public static final String NO_AUTHENTICATION_KUBECONFIG = "CMA-0009";
  public static final String NO_CLIENT_CA_LOOKUP_CLIENT = "CMA-0010";
  public static final String CLIENT_CA_LOOKUP_FAILED = "CMA-0011";
  public static final String NO_AUTHORIZATION_KUBECONFIG = "CMA-0012";
  public static final String AUDIT_LOG_WITHOUT_POLICY = "CMA-0013";
  public static final String AUDIT_LOG_ENABLED = "CMA-0014";
  public static final String FLOW_CONTROL_ENABLED = "CMA-0015";
  public static final String SERVER_STARTED = "CMA-0016";
  public static final String SERVER_STOPPED = "CMA-0017";
  public static final String REST_AUTHENTICATION_FAILED = "CMA-0018";
  public static final String REST_AUTHORIZATION_DENIED = "CMA-0019";
  public static final String APIEXCEPTION_FROM_TOKEN_REVIEW = "CMA-0020";
  public static final String APIEXCEPTION_FROM_SUBJECT_ACCESS_REVIEW = "CMA-0021";
  public static final String AUDIT_WRITE_FAILED = "CMA-0022";
  public static final String CLIENT_CONFIG_LOAD_FAILED = "CMA-0023";
  public static final String PROFILING_ENABLED = "CMA-0024";
  public static final String FEATURE_GATES = "CMA-0025";

  private MessageKeys() {
  }
}
