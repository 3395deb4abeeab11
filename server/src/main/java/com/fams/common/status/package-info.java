/**
 * Contains classes for error handling and status reporting.
 *
 * <p>Registry, binding and store operations report failures through these types instead of
 * throwing. The central classes are:
 *
 * <ul>
 *   <li>{@link com.fams.common.status.StatusCode} - Enum of possible status codes, aligned with
 *       gRPC and HTTP status codes</li>
 *   <li>{@link com.fams.common.status.Status} - A status with an optional reason, message and
 *       cause</li>
 *   <li>{@link com.fams.common.status.StatusOr} - Container that holds either a successful value
 *       or an error status</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;Position&gt; result = registry.get(positionId);
 * if (result.isOk()) {
 *     Position position = result.getValue();
 *     // ...
 * } else if (result.getStatus().isRetryable()) {
 *     // storage outage: retry with backoff
 * } else {
 *     Logger.warn("Position lookup failed: {}", result.getStatus());
 * }
 * </pre>
 */
package com.fams.common.status;
