package com.lesson.reconciliation.align;

import com.lesson.reconciliation.core.model.AlignmentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks in-flight and unsuccessful alignment attempts by DB lesson id.
 * Successful attempts leave no state behind.
 */
public class AlignmentTracker {
    private static final Logger log = LoggerFactory.getLogger(AlignmentTracker.class);

    private final ConcurrentMap<String, AlignmentState> states = new ConcurrentHashMap<>();

    /**
     * Marks an attempt as started.
     *
     * @return false if an attempt for this lesson is already pending
     */
    public boolean begin(String lessonId) {
        AlignmentState previous = states.get(lessonId);
        if (previous != null && previous.isPending()) {
            return false;
        }
        boolean started = previous == null
                ? states.putIfAbsent(lessonId, AlignmentState.pending()) == null
                : states.replace(lessonId, previous, AlignmentState.pending());
        if (!started) {
            log.debug("Alignment of lesson {} already in progress", lessonId);
        }
        return started;
    }

    public void blocked(String lessonId, String reason) {
        states.put(lessonId, AlignmentState.blocked(reason));
    }

    public void failed(String lessonId, String reason) {
        states.put(lessonId, AlignmentState.failed(reason));
    }

    public void succeeded(String lessonId) {
        states.remove(lessonId);
    }

    public Optional<AlignmentState> get(String lessonId) {
        return Optional.ofNullable(states.get(lessonId));
    }

    public Map<String, AlignmentState> snapshot() {
        return Map.copyOf(states);
    }
}
