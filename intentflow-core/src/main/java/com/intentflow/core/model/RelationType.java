package com.intentflow.core.model;

public enum RelationType {
    /** role -> category the role has worked with */
    ACCESSED,
    /** entity or activity -> category */
    IN_CATEGORY,
    /** activity -> entity it acted on */
    TARGETED,
    /** role -> activity */
    PERFORMED
}
