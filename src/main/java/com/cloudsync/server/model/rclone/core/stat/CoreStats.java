package com.cloudsync.server.model.rclone.core.stat;

import lombok.Data;

import java.util.List;

/**
 * The {@code stats} object of an rclone JSON log line. Same shape as the {@code core/stats} rc response.
 */
@Data
public class CoreStats {

    // total transferred bytes
    private long bytes;

    // total checked files
    private long checks;

    // total deleted files
    private long deletes;

    // seconds since the operation started
    private double elapsedTime;

    // total errors
    private long errors;

    // estimated seconds until the group completes, null when unknown
    private Double eta;

    // whether there has at least one fatal error
    private boolean fatalError;

    // last error as string
    private String lastError;

    // total files renamed
    private long renames;

    // whether there has at one non-retry error
    private boolean retryError;

    // bytes in seconds, as reported by rclone
    private double speed;

    // total bytes "plans" to transferred
    private long totalBytes;

    // total files "plans" to check
    private long totalChecks;

    // total files "plans" to transferred
    private long totalTransfers;

    // total time spend actually transfer
    private double transferTime;

    // total files actually transfer
    private long transfers;

    // transferring job stat
    private List<TransferringJobStat> transferring;

    // list of files name of currently checking files
    private List<String> checking;
}
