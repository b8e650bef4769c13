package com.cloudsync.server.model.api.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncStats {

    // summed speed of running jobs, bytes per second
    private double speed;

    // summed bytes of the current runs
    private long bytes;

    // summed files of the current runs
    private long transfers;

    // supervised rclone processes
    private int activeJobs;

    private StorageStats storage;
}
