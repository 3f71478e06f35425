package com.phillippitts.voicegate.domain;

public enum EngagementLevel {
    LOW, MEDIUM, HIGH
}
