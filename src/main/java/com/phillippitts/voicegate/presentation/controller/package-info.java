/**
 * REST controllers.
 *
 * <ul>
 *   <li>{@link com.phillippitts.voicegate.presentation.controller.VoiceSessionController}
 *       - {@code /session}: open, end, heartbeat, quota status</li>
 *   <li>{@link com.phillippitts.voicegate.presentation.controller.ConversationLogController}
 *       - {@code /conversation/log}: capture event ingestion and per-session stats</li>
 *   <li>{@link com.phillippitts.voicegate.presentation.controller.AdminSessionController}
 *       - {@code /admin}: force close, active sessions, unblock, daily costs.
 *       Authentication is expected in front of the service.</li>
 * </ul>
 */
package com.phillippitts.voicegate.presentation.controller;
