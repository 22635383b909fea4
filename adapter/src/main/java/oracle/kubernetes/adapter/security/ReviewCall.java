// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.security;

import io.kubernetes.client.openapi.ApiException;

/**
 * Posts a review object to the Kubernetes API server and returns the object with its status filled in.
 *
 * @param <T> the review type
 */
@FunctionalInterface
interface ReviewCall<T> {
  T create(T body) throws ApiException;
}
