package com.cloudsync.server.service.rclone;

import com.cloudsync.server.exception.JsonException;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.rclone.core.stat.CoreStats;
import com.cloudsync.server.model.rclone.core.stat.TransferringJobStat;
import com.cloudsync.server.model.rclone.log.RcloneJsonLog;
import com.cloudsync.server.util.FormatUtil;
import com.cloudsync.server.util.JsonUtil;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns rclone {@code --use-json-log} lines into job progress fields.
 * <p>
 * Speed is not taken from rclone's own figure. It is derived from the byte delta between
 * samples at least {@code minSampleIntervalMillis} apart, clamped to {@code maxSpeedBytes}
 * and blended as {@code 0.6 * previous + 0.4 * sample}. The sampling accumulators live here,
 * keyed by job id, and never on the job itself.
 */
@Service
@Slf4j
public class RcloneTelemetryParser {

    private static final double PREVIOUS_WEIGHT = 0.6;

    private static final double SAMPLE_WEIGHT = 0.4;

    // <jobId, SmoothingState>
    private final Map<String, SmoothingState> smoothingStates = new ConcurrentHashMap<>();

    private final SystemSettings systemSettings;

    private final Clock clock;

    @Autowired
    public RcloneTelemetryParser(SystemSettings systemSettings, Clock clock) {
        this.systemSettings = systemSettings;
        this.clock = clock;
    }

    // 返回 true 表示 job 的进度被更新
    public boolean acceptLine(SyncJobEntity job, String line) {
        if (ObjectUtils.isEmpty(job) || StringUtils.isBlank(line)) {
            return false;
        }
        String trimmed = line.trim();
        // 非 json 的诊断输出
        if (!trimmed.startsWith("{")) {
            return false;
        }
        RcloneJsonLog rcloneJsonLog;
        try {
            rcloneJsonLog = JsonUtil.parseJsonLine(trimmed, RcloneJsonLog.class);
        } catch (JsonException e) {
            log.debug("malformed rclone log line ignored. jobId is {}. line is {}", job.getId(), trimmed);
            return false;
        }
        if (ObjectUtils.isEmpty(rcloneJsonLog) || ObjectUtils.isEmpty(rcloneJsonLog.getStats())) {
            return false;
        }
        this.applyStats(job, rcloneJsonLog.getStats(), this.clock.millis());
        return true;
    }

    public void applyStats(SyncJobEntity job, CoreStats stats, long nowMillis) {
        synchronized (job) {
            job.setBytesTransferred(stats.getBytes());
            job.setTotalBytes(stats.getTotalBytes());
            job.setFilesTransferred(stats.getTransfers());
            job.setTotalFiles(stats.getTotalTransfers());
            job.setProgress(computeProgress(stats));
            this.updateSpeed(job, stats.getBytes(), nowMillis);
            if (ObjectUtils.isNotEmpty(stats.getEta()) && stats.getEta() > 0) {
                job.setEta(FormatUtil.formatDuration(Math.round(stats.getEta())));
            }
            updateTransferring(job, stats.getTransferring());
        }
    }

    public void reset(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            return;
        }
        this.smoothingStates.remove(jobId);
    }

    static int computeProgress(CoreStats stats) {
        double ratio;
        if (stats.getTotalBytes() > 0) {
            ratio = (double) stats.getBytes() / stats.getTotalBytes();
        } else if (stats.getTotalTransfers() > 0) {
            // 总字节未知, 按文件数
            ratio = (double) stats.getTransfers() / stats.getTotalTransfers();
        } else {
            return 0;
        }
        long percent = Math.round(ratio * 100);
        return (int) Math.max(0, Math.min(100, percent));
    }

    private void updateSpeed(SyncJobEntity job, long bytes, long nowMillis) {
        SystemSettings.Telemetry telemetry = this.systemSettings.getTelemetry();
        SmoothingState state = this.smoothingStates.get(job.getId());
        // 第一个样本只记录基准
        if (ObjectUtils.isEmpty(state)) {
            this.smoothingStates.put(job.getId(), new SmoothingState(nowMillis, bytes));
            job.setSpeed(0);
            return;
        }
        long elapsedMillis = nowMillis - state.sampledAt;
        if (elapsedMillis < telemetry.getMinSampleIntervalMillis()) {
            return;
        }
        double rate = Math.max(0, bytes - state.bytes) / (elapsedMillis / 1000.0);
        double capped = Math.min(rate, telemetry.getMaxSpeedBytes());
        double speed = PREVIOUS_WEIGHT * job.getSpeed() + SAMPLE_WEIGHT * capped;
        if (speed < telemetry.getIdleSpeedFloorBytes()) {
            speed = 0;
        }
        job.setSpeed(speed);
        job.setLastSpeed(speed);
        state.sampledAt = nowMillis;
        state.bytes = bytes;
    }

    // rclone 在没有传输时省略 transferring 字段
    private static void updateTransferring(SyncJobEntity job, List<TransferringJobStat> transferring) {
        if (CollectionUtils.isEmpty(transferring)) {
            job.setTransferring(null);
            job.setCurrentFile(null);
            job.setCurrentFileSize(null);
            job.setCurrentFileBytes(null);
            return;
        }
        job.setTransferring(new ArrayList<>(transferring));
        TransferringJobStat first = transferring.get(0);
        job.setCurrentFile(first.getName());
        job.setCurrentFileSize(first.getSize());
        job.setCurrentFileBytes(first.getBytes());
    }

    @AllArgsConstructor
    private static class SmoothingState {

        private long sampledAt;

        private long bytes;
    }
}
