package com.intentflow.core.bus.payload;

import java.util.UUID;

public record CancelRequest(UUID taskId, String reason) {
}
