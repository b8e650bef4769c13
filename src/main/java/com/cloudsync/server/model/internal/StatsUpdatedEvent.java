package com.cloudsync.server.model.internal;

import com.cloudsync.server.model.api.stats.SyncStats;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StatsUpdatedEvent {

    private SyncStats stats;
}
