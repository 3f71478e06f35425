/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicegate.exception.VoiceGateException} - Base exception</li>
 *   <li>{@link com.phillippitts.voicegate.exception.ProviderUnavailableException} - Credential
 *       broker retry budget exhausted on transient failures</li>
 *   <li>{@link com.phillippitts.voicegate.exception.ProviderRequestException} - Provider rejected
 *       the request terminally, no retry</li>
 *   <li>{@link com.phillippitts.voicegate.exception.InvalidIdentityException} - Request carries no
 *       usable client identity</li>
 *   <li>{@link com.phillippitts.voicegate.exception.SessionNotFoundException} - Unknown session id</li>
 *   <li>{@link com.phillippitts.voicegate.exception.SessionStoreException} - Relational store
 *       failure, wrapped with the operation name</li>
 * </ul>
 *
 * <p>Admission denials are not exceptions: the usage limiter returns a typed
 * {@link com.phillippitts.voicegate.domain.AdmissionDecision}.
 *
 * @see com.phillippitts.voicegate.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicegate.exception;
