package com.phillippitts.voicegate.service.capture;

import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;

/**
 * Computes best-effort annotations for a turn. Implementations must be local, fast, and free of
 * side effects; the router calls them on the request thread.
 */
@FunctionalInterface
public interface TurnAnnotator {

    TurnAnnotator NONE = (speaker, text) -> TurnAnnotations.NONE;

    TurnAnnotations annotate(Speaker speaker, String text);
}
