package com.cloudsync.server.model.entity;

import com.cloudsync.server.enums.DiffStatusEnum;
import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.model.rclone.core.stat.TransferringJobStat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A recurring source to destination sync job. Progress fields are only meaningful while
 * {@link #status} is running, or as the final snapshot right after success/error.
 * <p>
 * Writers mutate an instance while holding its monitor; readers take a {@link #snapshot}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncJobEntity {

    public static final String DEFAULT_NAME = "Unnamed Job";

    public static final int DEFAULT_INTERVAL_MINUTES = 60;

    public static final int DEFAULT_CONCURRENCY = 8;

    public static final int DEFAULT_TIMEOUT_SEC = 30;

    public static final int DEFAULT_RETRIES = 10;

    private String id;

    private String name;

    private String source;

    private String destination;

    private Integer intervalMinutes;

    // --transfers
    private Integer concurrency;

    // seconds
    private Integer timeout;

    private Integer retries;

    private JobStatusEnum status;

    private String lastError;

    private Instant lastRun;

    private Instant nextRun;

    private Instant startedAt;

    // 0 - 100
    private int progress;

    private long bytesTransferred;

    private long totalBytes;

    private long filesTransferred;

    private long totalFiles;

    // bytes per second, smoothed
    private double speed;

    private double lastSpeed;

    private String eta;

    private String currentFile;

    private Long currentFileSize;

    private Long currentFileBytes;

    private List<TransferringJobStat> transferring;

    private DiffStatusEnum diffStatus;

    private Instant lastDiffCheck;

    // 0 or 1, not a file count
    private Integer pendingChanges;

    // 仅出现在对外的快照中, 不写入 jobs.json
    private AnalyticsEntity analytics;

    public synchronized SyncJobEntity snapshot(AnalyticsEntity analyticsEntity) {
        List<TransferringJobStat> transferringCopy = CollectionUtils.isEmpty(this.transferring) ?
                null :
                new ArrayList<>(this.transferring);
        return this.toBuilder()
                .transferring(transferringCopy)
                .analytics(ObjectUtils.isEmpty(analyticsEntity) ? null : analyticsEntity.copy())
                .build();
    }

    public synchronized SyncJobEntity persistentCopy() {
        return this.snapshot(null);
    }

    public Duration intervalDuration() {
        return Duration.ofMinutes(ObjectUtils.defaultIfNull(this.intervalMinutes, DEFAULT_INTERVAL_MINUTES));
    }

    // 开始一次运行前清零进度
    public synchronized void resetProgress() {
        this.progress = 0;
        this.bytesTransferred = 0;
        this.filesTransferred = 0;
        this.totalBytes = 0;
        this.totalFiles = 0;
        this.speed = 0;
        this.lastSpeed = 0;
        this.eta = null;
        this.currentFile = null;
        this.currentFileSize = null;
        this.currentFileBytes = null;
        this.transferring = null;
    }
}
