package com.dataworks.orchestrator.agent;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/** One natural-language task; drives exactly one run. */
public record Task(UUID id, String description, Instant createdAt) {

    public static Task of(String description, Clock clock) {
        return new Task(UUID.randomUUID(), description, clock.instant());
    }
}
