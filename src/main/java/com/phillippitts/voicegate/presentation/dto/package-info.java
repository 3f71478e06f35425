/**
 * JSON request and response records of the HTTP API.
 */
package com.phillippitts.voicegate.presentation.dto;
