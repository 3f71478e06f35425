package com.phillippitts.voicegate.domain;

/**
 * Best-effort annotations computed locally at capture time. Not authoritative.
 *
 * @param topic            keyword-matched topic category, "general" when nothing matched
 * @param requiresFollowUp turn asks a question or invites a reply
 * @param containsFeedback turn carries positive feedback
 * @param engagementLevel  coarse level from length and punctuation, null when not computed
 */
public record TurnAnnotations(
        String topic,
        boolean requiresFollowUp,
        boolean containsFeedback,
        EngagementLevel engagementLevel
) {
    public static final TurnAnnotations NONE = new TurnAnnotations(null, false, false, null);
}
