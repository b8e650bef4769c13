package com.cloudsync.server.model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsEntity {

    private long successCount;

    private long errorCount;

    private long totalBytes;

    // bytes per second, exponentially smoothed across successful runs
    private double avgSpeed;

    public AnalyticsEntity copy() {
        return new AnalyticsEntity(this.successCount, this.errorCount, this.totalBytes, this.avgSpeed);
    }
}
