package com.intentflow.worker.tool;

public record ToolParameter(
    String name,
    String type,
    boolean required
) {
}
