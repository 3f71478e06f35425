package com.phillippitts.voicegate.service.capture;

import com.phillippitts.voicegate.domain.EngagementLevel;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword and punctuation heuristics.
 *
 * <p>User turns get an engagement level. Assistant turns get a topic, a follow-up flag and a
 * feedback flag. Keywords match whole words, in English and French.
 */
@Component
public class KeywordTurnAnnotator implements TurnAnnotator {

    static final String GENERAL_TOPIC = "general";

    private static final Map<String, Pattern> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("fitness", words("exercise", "exercice", "workout", "training", "entraînement", "musculation"));
        TOPICS.put("nutrition", words("nutrition", "diet", "alimentation", "protein", "protéine"));
        TOPICS.put("motivation", words("motivation", "encouragement", "bravo", "keep going"));
        TOPICS.put("goals", words("goal", "goals", "objectif", "objectifs", "target"));
        TOPICS.put("equipment", words("equipment", "équipement", "machine", "machines", "matériel"));
    }

    private static final Pattern FOLLOW_UP = words("would you like", "do you want", "shall we", "how about",
            "veux-tu", "aimerais-tu", "penses-tu", "comment");

    private static final Pattern FEEDBACK = words("bravo", "excellent", "well done", "great job",
            "congratulations", "bien joué", "félicitations", "super");

    private static final int HIGH_LENGTH = 100;
    private static final int MEDIUM_LENGTH = 30;

    @Override
    public TurnAnnotations annotate(Speaker speaker, String text) {
        if (text == null || text.isBlank()) {
            return TurnAnnotations.NONE;
        }
        if (speaker == Speaker.USER) {
            return new TurnAnnotations(null, false, false, engagementOf(text));
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return new TurnAnnotations(topicOf(lower), needsFollowUp(text, lower),
                FEEDBACK.matcher(lower).find(), null);
    }

    static String topicOf(String lower) {
        for (Map.Entry<String, Pattern> e : TOPICS.entrySet()) {
            if (e.getValue().matcher(lower).find()) {
                return e.getKey();
            }
        }
        return GENERAL_TOPIC;
    }

    static boolean needsFollowUp(String text, String lower) {
        return text.indexOf('?') >= 0 || FOLLOW_UP.matcher(lower).find();
    }

    static EngagementLevel engagementOf(String text) {
        int questions = count(text, '?');
        int exclamations = count(text, '!');
        if (text.length() > HIGH_LENGTH || questions > 1 || exclamations > 1) {
            return EngagementLevel.HIGH;
        }
        if (text.length() > MEDIUM_LENGTH || questions > 0 || exclamations > 0) {
            return EngagementLevel.MEDIUM;
        }
        return EngagementLevel.LOW;
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private static Pattern words(String... keywords) {
        List<String> quoted = Arrays.stream(keywords).map(Pattern::quote).toList();
        return Pattern.compile("(?<![\\p{L}\\p{N}])(" + String.join("|", quoted) + ")(?![\\p{L}\\p{N}])",
                Pattern.UNICODE_CASE | Pattern.CASE_INSENSITIVE);
    }
}
