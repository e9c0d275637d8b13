package com.morket.replication.dlq.dto;

public record ResetExhaustedResponse(int resetCount) {
}
