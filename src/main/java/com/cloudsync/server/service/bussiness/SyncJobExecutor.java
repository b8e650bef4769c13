package com.cloudsync.server.service.bussiness;

import com.cloudsync.server.enums.ActivityTypeEnum;
import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.exception.BusinessException;
import com.cloudsync.server.exception.CloudSyncException;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.ActivityLogEntity;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.rclone.global.RcloneExecResult;
import com.cloudsync.server.service.cache.ProcessRegistry;
import com.cloudsync.server.service.db.ActivityLogService;
import com.cloudsync.server.service.db.AnalyticsService;
import com.cloudsync.server.service.db.SyncJobStore;
import com.cloudsync.server.service.rclone.RcloneFacadeService;
import com.cloudsync.server.service.rclone.RcloneTelemetryParser;
import com.cloudsync.server.service.rclone.StreamLineBuffer;
import com.cloudsync.server.service.rclone.SupervisedProcess;
import com.cloudsync.server.util.FormatUtil;
import com.cloudsync.server.util.RemotePathUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * One sync run of a job: precondition probes, spawn, telemetry, finalization.
 * <p>
 * The caller claims the job in {@link ProcessRegistry} before calling {@link #executeJob}; the
 * claim is released here once the run has been finalized, whatever the outcome.
 */
@Service
@Slf4j
public class SyncJobExecutor {

    private final RcloneFacadeService rcloneFacadeService;

    private final RcloneTelemetryParser rcloneTelemetryParser;

    private final ProcessRegistry processRegistry;

    private final SyncJobStore syncJobStore;

    private final ActivityLogService activityLogService;

    private final AnalyticsService analyticsService;

    private final JobNotifier jobNotifier;

    private final SystemSettings systemSettings;

    private final Clock clock;

    // <jobId, last progress emit millis>
    private final Map<String, Long> lastProgressEmit = new ConcurrentHashMap<>();

    @Autowired
    public SyncJobExecutor(
            RcloneFacadeService rcloneFacadeService,
            RcloneTelemetryParser rcloneTelemetryParser,
            ProcessRegistry processRegistry,
            SyncJobStore syncJobStore,
            ActivityLogService activityLogService,
            AnalyticsService analyticsService,
            JobNotifier jobNotifier,
            SystemSettings systemSettings,
            Clock clock) {
        this.rcloneFacadeService = rcloneFacadeService;
        this.rcloneTelemetryParser = rcloneTelemetryParser;
        this.processRegistry = processRegistry;
        this.syncJobStore = syncJobStore;
        this.activityLogService = activityLogService;
        this.analyticsService = analyticsService;
        this.jobNotifier = jobNotifier;
        this.systemSettings = systemSettings;
        this.clock = clock;
    }

    // 返回的 future 在 job 终结且 registry 释放后完成, 不会异常完成
    public CompletableFuture<Void> executeJob(SyncJobEntity job, SupervisedProcess supervisedProcess) {
        CompletableFuture<Void> pipeline;
        try {
            pipeline = this.checkPreconditions(job)
                    .thenCompose(v -> this.startSync(job, supervisedProcess))
                    .thenAccept(result -> this.finish(job, supervisedProcess, result));
        } catch (RuntimeException e) {
            pipeline = CompletableFuture.failedFuture(e);
        }
        return pipeline.handle((v, ex) -> {
            try {
                if (ObjectUtils.isNotEmpty(ex)) {
                    this.fail(job, supervisedProcess, unwrap(ex));
                }
            } catch (RuntimeException e) {
                log.error("executeJob failed. finalize failed. job is {}", job.getId(), e);
            } finally {
                this.lastProgressEmit.remove(job.getId());
                this.rcloneTelemetryParser.reset(job.getId());
                this.processRegistry.release(supervisedProcess);
            }
            return null;
        });
    }

    private CompletableFuture<Void> checkPreconditions(SyncJobEntity job) {
        String source;
        String destination;
        synchronized (job) {
            source = job.getSource();
            destination = job.getDestination();
        }
        if (StringUtils.isAnyBlank(source, destination)) {
            return CompletableFuture.failedFuture(
                    new BusinessException("Source and destination are required"));
        }
        if (!RemotePathUtil.isRemotePath(source) && !RemotePathUtil.isLocalPathExist(source)) {
            return CompletableFuture.failedFuture(
                    new BusinessException("Source path does not exist: %s".formatted(source)));
        }
        if (!RemotePathUtil.isRemotePath(destination)) {
            return CompletableFuture.completedFuture(null);
        }
        String remoteName = RemotePathUtil.getRemoteName(destination);
        return this.rcloneFacadeService.isConnected(remoteName).thenCompose(connected -> connected ?
                CompletableFuture.completedFuture(null) :
                CompletableFuture.failedFuture(new BusinessException(
                        "Remote \"%s\" is not reachable or not configured.".formatted(remoteName))));
    }

    private CompletableFuture<RcloneExecResult> startSync(SyncJobEntity job, SupervisedProcess supervisedProcess) {
        synchronized (job) {
            // stopJob 在探测阶段被调用, job 已经是 idle
            if (supervisedProcess.isStopRequested()) {
                return CompletableFuture.completedFuture(RcloneExecResult.killed("", ""));
            }
            if (JobStatusEnum.isTransitionProhibit(job.getStatus(), JobStatusEnum.RUNNING)) {
                log.warn("status transition {} -> running is prohibited. job is {}", job.getStatus(), job.getId());
            }
            job.resetProgress();
            job.setStatus(JobStatusEnum.RUNNING);
            job.setLastError(null);
            job.setStartedAt(this.clock.instant());
        }
        this.rcloneTelemetryParser.reset(job.getId());
        this.lastProgressEmit.remove(job.getId());
        this.syncJobStore.persist();
        log.info("starting sync. job is {}", job.getId());
        this.activityLogService.info(job, "Starting sync: %s → %s".formatted(job.getSource(), job.getDestination()));
        this.jobNotifier.publishJobs();
        // 远端目录可能不存在
        CompletableFuture<RcloneExecResult> mkdirFuture = RemotePathUtil.isRemotePath(job.getDestination()) ?
                this.rcloneFacadeService.mkdir(job.getDestination()).handle((result, ex) -> {
                    if (ObjectUtils.isNotEmpty(ex) || !result.isSuccess()) {
                        log.debug("mkdir failed, destination might already exist. job is {}", job.getId());
                    }
                    return result;
                }) :
                CompletableFuture.completedFuture(null);
        return mkdirFuture.thenCompose(ignored -> {
            if (supervisedProcess.isStopRequested()) {
                return CompletableFuture.completedFuture(RcloneExecResult.killed("", ""));
            }
            StreamLineBuffer stdoutBuffer = new StreamLineBuffer();
            StreamLineBuffer stderrBuffer = new StreamLineBuffer();
            return this.rcloneFacadeService.sync(
                    job,
                    supervisedProcess,
                    chunk -> this.onOutput(job, supervisedProcess, stdoutBuffer.append(chunk)),
                    chunk -> this.onOutput(job, supervisedProcess, stderrBuffer.append(chunk))
            ).thenApply(result -> {
                // 最后一行可能没有换行
                this.onOutput(job, supervisedProcess, Collections.singletonList(stdoutBuffer.flush()));
                this.onOutput(job, supervisedProcess, Collections.singletonList(stderrBuffer.flush()));
                return result;
            });
        });
    }

    private void onOutput(SyncJobEntity job, SupervisedProcess supervisedProcess, Iterable<String> lines) {
        boolean updated = false;
        for (String line : lines) {
            synchronized (job) {
                // 进程退出前 pump 还会读到输出, stopJob 之后不再更新 job
                if (supervisedProcess.isStopRequested()) {
                    return;
                }
                if (this.rcloneTelemetryParser.acceptLine(job, line)) {
                    updated = true;
                }
            }
        }
        if (updated) {
            this.emitProgress(job, supervisedProcess);
        }
    }

    // 限流, 每个 job 每 200ms 最多一次
    private void emitProgress(SyncJobEntity job, SupervisedProcess supervisedProcess) {
        long now = this.clock.millis();
        long throttle = this.systemSettings.getTelemetry().getProgressThrottleMillis();
        boolean[] shouldEmit = {false};
        this.lastProgressEmit.compute(job.getId(), (id, last) -> {
            if (ObjectUtils.isEmpty(last) || now - last >= throttle) {
                shouldEmit[0] = true;
                return now;
            }
            return last;
        });
        if (!shouldEmit[0]) {
            return;
        }
        String message;
        ActivityLogEntity.ActivityDetails details;
        synchronized (job) {
            if (supervisedProcess.isStopRequested()) {
                return;
            }
            message = StringUtils.isNotBlank(job.getCurrentFile()) ?
                    "Syncing: %s".formatted(job.getCurrentFile()) :
                    "Transferred %d files...".formatted(job.getFilesTransferred());
            details = ActivityLogEntity.ActivityDetails.builder()
                    .progress(job.getProgress())
                    .speed(job.getSpeed())
                    .bytesTransferred(job.getBytesTransferred())
                    .filesTransferred(job.getFilesTransferred())
                    .eta(job.getEta())
                    .fileName(job.getCurrentFile())
                    .fileSize(job.getCurrentFileSize())
                    .totalBytes(job.getTotalBytes())
                    .build();
        }
        this.jobNotifier.publishJobs();
        this.activityLogService.log(ActivityTypeEnum.PROGRESS, job, message, details);
    }

    private void finish(SyncJobEntity job, SupervisedProcess supervisedProcess, RcloneExecResult result) {
        // stopJob 已经把 job 置为 idle
        if (result.isKilled() || supervisedProcess.isStopRequested()) {
            log.info("sync stopped by user. job is {}", job.getId());
            return;
        }
        if (!result.isSuccess()) {
            throw result.getBusinessException();
        }
        Instant now = this.clock.instant();
        long bytes;
        double finalSpeed;
        long durationSec;
        synchronized (job) {
            bytes = job.getBytesTransferred();
            finalSpeed = job.getLastSpeed();
            durationSec = ObjectUtils.isEmpty(job.getStartedAt()) ?
                    0 :
                    Math.round(Duration.between(job.getStartedAt(), now).toMillis() / 1000.0);
            job.setStatus(JobStatusEnum.SUCCESS);
            job.setProgress(100);
            job.setLastRun(now);
            job.setNextRun(now.plus(job.intervalDuration()));
            job.setSpeed(0);
            job.setTransferring(null);
            job.setCurrentFile(null);
            job.setCurrentFileSize(null);
            job.setCurrentFileBytes(null);
        }
        log.info("sync completed. job is {}. bytes is {}", job.getId(), bytes);
        this.syncJobStore.persist();
        this.activityLogService.log(
                ActivityTypeEnum.SUCCESS,
                job,
                "Sync completed in %s. Transferred %s".formatted(
                        FormatUtil.formatDuration(durationSec),
                        FormatUtil.formatBytes(bytes)),
                null);
        this.analyticsService.recordSuccess(job.getId(), bytes, finalSpeed);
        this.jobNotifier.publishJobs();
    }

    private void fail(SyncJobEntity job, SupervisedProcess supervisedProcess, Throwable ex) {
        if (supervisedProcess.isStopRequested()) {
            log.info("sync stopped by user, failure ignored. job is {}", job.getId());
            return;
        }
        String message = ex instanceof CloudSyncException ?
                ex.getMessage() :
                StringUtils.defaultIfBlank(ex.getMessage(), ex.toString());
        Instant now = this.clock.instant();
        synchronized (job) {
            job.setStatus(JobStatusEnum.ERROR);
            job.setLastError(message);
            job.setSpeed(0);
            // 失败后等一个周期再由调度器重试
            job.setNextRun(now.plus(job.intervalDuration()));
        }
        log.warn("executeJob failed. job is {}", job.getId(), ex);
        this.syncJobStore.persist();
        this.activityLogService.error(job, "Sync failed: %s".formatted(message));
        this.analyticsService.recordError(job.getId());
        this.jobNotifier.publishJobs();
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && ObjectUtils.isNotEmpty(current.getCause())) {
            current = current.getCause();
        }
        return current;
    }
}
