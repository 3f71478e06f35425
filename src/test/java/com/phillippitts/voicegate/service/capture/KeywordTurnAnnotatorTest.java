package com.phillippitts.voicegate.service.capture;

import com.phillippitts.voicegate.domain.EngagementLevel;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordTurnAnnotatorTest {

    private final KeywordTurnAnnotator annotator = new KeywordTurnAnnotator();

    @Test
    void userTurnsOnlyGetEngagement() {
        TurnAnnotations a = annotator.annotate(Speaker.USER, "I want to train for a marathon");

        assertThat(a.topic()).isNull();
        assertThat(a.requiresFollowUp()).isFalse();
        assertThat(a.engagementLevel()).isEqualTo(EngagementLevel.LOW);
    }

    @Test
    void assistantTurnsGetTopicFollowUpAndFeedback() {
        TurnAnnotations a = annotator.annotate(Speaker.ASSISTANT,
                "Great job on your workout today. Would you like to add more protein?");

        assertThat(a.topic()).isEqualTo("fitness");
        assertThat(a.requiresFollowUp()).isTrue();
        assertThat(a.containsFeedback()).isTrue();
        assertThat(a.engagementLevel()).isNull();
    }

    @Test
    void blankTextGetsNothing() {
        assertThat(annotator.annotate(Speaker.ASSISTANT, "  ")).isEqualTo(TurnAnnotations.NONE);
    }

    @Test
    void topicMatchesWholeWordsOnly() {
        assertThat(KeywordTurnAnnotator.topicOf("let's set a goal")).isEqualTo("goals");
        assertThat(KeywordTurnAnnotator.topicOf("the goalkeeper saved it")).isEqualTo(KeywordTurnAnnotator.GENERAL_TOPIC);
        assertThat(KeywordTurnAnnotator.topicOf("plus de protéine")).isEqualTo("nutrition");
    }

    @Test
    void followUpOnQuestionMarkOrInvitation() {
        assertThat(KeywordTurnAnnotator.needsFollowUp("Ready?", "ready?")).isTrue();
        assertThat(KeywordTurnAnnotator.needsFollowUp("How about squats", "how about squats")).isTrue();
        assertThat(KeywordTurnAnnotator.needsFollowUp("Rest now.", "rest now.")).isFalse();
    }

    @Test
    void engagementFromLengthAndPunctuation() {
        assertThat(KeywordTurnAnnotator.engagementOf("ok")).isEqualTo(EngagementLevel.LOW);
        assertThat(KeywordTurnAnnotator.engagementOf("really?")).isEqualTo(EngagementLevel.MEDIUM);
        assertThat(KeywordTurnAnnotator.engagementOf("a".repeat(31))).isEqualTo(EngagementLevel.MEDIUM);
        assertThat(KeywordTurnAnnotator.engagementOf("wow! really!")).isEqualTo(EngagementLevel.HIGH);
        assertThat(KeywordTurnAnnotator.engagementOf("a".repeat(101))).isEqualTo(EngagementLevel.HIGH);
    }
}
