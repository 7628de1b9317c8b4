package com.intentflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CompletenessTest {

    @Test
    void of_shouldClassifyCompensationCoverage() {
        assertEquals(Completeness.NOT_REQUIRED, Completeness.of(0, 0, 0));
        assertEquals(Completeness.FULL, Completeness.of(2, 2, 2));
        assertEquals(Completeness.PARTIAL, Completeness.of(2, 1, 1));
        assertEquals(Completeness.NONE, Completeness.of(3, 2, 0));
    }

    @Test
    void of_shouldNotRequireRollbackOfReadOnlyWork() {
        assertEquals(Completeness.NOT_REQUIRED, Completeness.of(2, 0, 0));
        assertEquals(Completeness.NOT_REQUIRED, Completeness.of(1, 0, 0));
    }
}
