/**
 * Immutable domain model for voice sessions, admission records, conversation turns and cost records.
 */
package com.phillippitts.voicegate.domain;
