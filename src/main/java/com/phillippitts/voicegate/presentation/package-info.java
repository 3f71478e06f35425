/**
 * Presentation layer (REST API controllers, request/response DTOs and exception handling).
 *
 * <p>Presentation depends on the service layer, never the reverse.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - session, conversation capture and operator endpoints</li>
 *   <li>{@code presentation.dto} - JSON request and response records</li>
 *   <li>{@code presentation.exception} - mapping of domain exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they resolve the client identity, validate the request shape and
 * delegate. Business rules live in services.
 *
 * @see com.phillippitts.voicegate.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicegate.presentation;
