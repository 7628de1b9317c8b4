package com.intentflow.core.model;

public enum NodeType {
    ROLE,
    CATEGORY,
    ENTITY,
    ACTIVITY
}
