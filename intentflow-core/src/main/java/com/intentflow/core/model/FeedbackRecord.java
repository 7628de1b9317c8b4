package com.intentflow.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Human rating of a finished task. Ratings run from 1 (bad) to 5 (good).
 */
public record FeedbackRecord(
    UUID taskId,
    int humanRating,
    String correctionNotes,
    Instant timestamp
) {
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    public FeedbackRecord {
        Objects.requireNonNull(taskId, "taskId");
        if (humanRating < MIN_RATING || humanRating > MAX_RATING) {
            throw new IllegalArgumentException("humanRating must be between 1 and 5");
        }
    }
}
