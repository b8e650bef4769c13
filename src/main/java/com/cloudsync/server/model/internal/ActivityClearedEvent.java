package com.cloudsync.server.model.internal;

import lombok.Data;

import java.time.Instant;

@Data
public class ActivityClearedEvent {

    private final Instant clearedAt = Instant.now();
}
