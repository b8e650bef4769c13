package com.cloudsync.server.model.rclone.core.stat;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;


@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferringJobStat {

    // file name
    private String name;

    // size in bytes
    private long size;

    // transferred bytes
    private long bytes;

    // progress of transferring
    private double percentage;

    // bytes per second
    private double speed;

    // average speed
    private double speedAvg;

    // seconds left for current file, may be null
    private Double eta;
}
