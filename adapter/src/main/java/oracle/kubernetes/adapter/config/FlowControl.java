// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.config;

import java.util.concurrent.Semaphore;

import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1beta2FlowSchema;
import io.kubernetes.client.openapi.models.V1beta2FlowSchemaList;
import io.kubernetes.client.openapi.models.V1beta2PriorityLevelConfiguration;
import io.kubernetes.client.openapi.models.V1beta2PriorityLevelConfigurationList;
import oracle.kubernetes.adapter.client.VersionedInformers;

/**
 * API priority and fairness, reduced to a single concurrency limit shared by all requests. The
 * flow schema and priority level informers are registered with the shared informer factory so
 * that they start and stop along with the server.
 */
public class FlowControl {

  static final String FLOW_CONTROL_GROUP = "flowcontrol.apiserver.k8s.io";
  static final String FLOW_CONTROL_VERSION = "v1beta2";

  private final ApiClient client;
  private final int totalLimit;
  private final Semaphore seats;
  private final SharedIndexInformer<V1beta2FlowSchema> flowSchemas;
  private final SharedIndexInformer<V1beta2PriorityLevelConfiguration> priorityLevels;
  private final VersionedInformers informers;

  /**
   * Creates the flow controller.
   * @param client the client used to write flow control status
   * @param informers the shared informer factory, which watches the flow control configuration
   * @param totalLimit the number of requests which may be in progress at once. Must be positive.
   */
  public FlowControl(ApiClient client, VersionedInformers informers, int totalLimit) {
    if (totalLimit <= 0) {
      throw new IllegalArgumentException("total concurrency limit must be positive but was " + totalLimit);
    }
    this.client = client;
    this.totalLimit = totalLimit;
    this.seats = new Semaphore(totalLimit, true);
    this.informers = informers;
    this.flowSchemas = informers.informerFor(V1beta2FlowSchema.class, V1beta2FlowSchemaList.class,
          FLOW_CONTROL_GROUP, FLOW_CONTROL_VERSION, "flowschemas");
    this.priorityLevels = informers.informerFor(
          V1beta2PriorityLevelConfiguration.class, V1beta2PriorityLevelConfigurationList.class,
          FLOW_CONTROL_GROUP, FLOW_CONTROL_VERSION, "prioritylevelconfigurations");
  }

  public ApiClient getClient() {
    return client;
  }

  public int getTotalLimit() {
    return totalLimit;
  }

  public int getAvailableSeats() {
    return seats.availablePermits();
  }

  /**
   * Returns true once both flow control informers have completed their initial list.
   */
  public boolean hasSynced() {
    return flowSchemas.hasSynced() && priorityLevels.hasSynced();
  }

  /**
   * Claims a seat for a request without waiting.
   * @return true if the request may proceed; the caller must then call {@link #release()}
   */
  public boolean tryAcquire() {
    return seats.tryAcquire();
  }

  public void release() {
    seats.release();
  }

  public void start() {
    informers.start();
  }

  public void stop() {
    informers.stop();
  }
}
