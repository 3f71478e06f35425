/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.voicegate.exception.InvalidIdentityException} and request validation errors
 *       → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.voicegate.exception.SessionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.voicegate.exception.ProviderUnavailableException},
 *       {@link com.phillippitts.voicegate.exception.ProviderRequestException} and
 *       {@link com.phillippitts.voicegate.exception.SessionStoreException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SessionNotFoundException",
 *   "message": "Session not found",
 *   "details": "No session rt_4f1c...",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Storage and provider details are logged server-side only.
 */
package com.phillippitts.voicegate.presentation.exception;
