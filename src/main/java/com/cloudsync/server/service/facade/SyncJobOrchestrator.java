package com.cloudsync.server.service.facade;

import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.job.CreateJobRequest;
import com.cloudsync.server.model.api.job.UpdateJobRequest;
import com.cloudsync.server.model.api.stats.SyncStats;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.ActivityLogEntity;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.service.bussiness.DiffChecker;
import com.cloudsync.server.service.bussiness.JobNotifier;
import com.cloudsync.server.service.bussiness.StatsService;
import com.cloudsync.server.service.bussiness.SyncJobExecutor;
import com.cloudsync.server.service.cache.ProcessRegistry;
import com.cloudsync.server.service.db.ActivityLogService;
import com.cloudsync.server.service.db.AnalyticsService;
import com.cloudsync.server.service.db.SyncJobStore;
import com.cloudsync.server.service.rclone.SupervisedProcess;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Public surface of the job engine. Owns the job table through {@link SyncJobStore} and the
 * running processes through {@link ProcessRegistry}; every start, user or scheduler initiated,
 * goes through {@link #trigger(SyncJobEntity)}.
 */
@Service
@Slf4j
public class SyncJobOrchestrator {

    private final SyncJobStore syncJobStore;

    private final ActivityLogService activityLogService;

    private final AnalyticsService analyticsService;

    private final ProcessRegistry processRegistry;

    private final SyncJobExecutor syncJobExecutor;

    private final DiffChecker diffChecker;

    private final StatsService statsService;

    private final JobNotifier jobNotifier;

    private final TaskExecutor jobTaskExecutor;

    private final SystemSettings systemSettings;

    private final Clock clock;

    @Autowired
    public SyncJobOrchestrator(
            SyncJobStore syncJobStore,
            ActivityLogService activityLogService,
            AnalyticsService analyticsService,
            ProcessRegistry processRegistry,
            SyncJobExecutor syncJobExecutor,
            DiffChecker diffChecker,
            StatsService statsService,
            JobNotifier jobNotifier,
            @Qualifier("jobTaskExecutor") TaskExecutor jobTaskExecutor,
            SystemSettings systemSettings,
            Clock clock) {
        this.syncJobStore = syncJobStore;
        this.activityLogService = activityLogService;
        this.analyticsService = analyticsService;
        this.processRegistry = processRegistry;
        this.syncJobExecutor = syncJobExecutor;
        this.diffChecker = diffChecker;
        this.statsService = statsService;
        this.jobNotifier = jobNotifier;
        this.jobTaskExecutor = jobTaskExecutor;
        this.systemSettings = systemSettings;
        this.clock = clock;
    }

    public SyncJobEntity addJob(CreateJobRequest createJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(createJobRequest)) {
            throw new ValidationException("addJob failed. createJobRequest is null");
        }
        String jobId = StringUtils.isBlank(createJobRequest.getId()) ?
                UUID.randomUUID().toString() :
                createJobRequest.getId();
        if (this.syncJobStore.contains(jobId)) {
            throw new ValidationException("addJob failed. job %s already exists".formatted(jobId));
        }
        int intervalMinutes = ObjectUtils.defaultIfNull(
                createJobRequest.getIntervalMinutes(), SyncJobEntity.DEFAULT_INTERVAL_MINUTES);
        SyncJobEntity job = SyncJobEntity.builder()
                .id(jobId)
                .name(StringUtils.defaultIfBlank(createJobRequest.getName(), SyncJobEntity.DEFAULT_NAME))
                .source(createJobRequest.getSource())
                .destination(createJobRequest.getDestination())
                .intervalMinutes(intervalMinutes)
                .concurrency(ObjectUtils.defaultIfNull(createJobRequest.getConcurrency(), SyncJobEntity.DEFAULT_CONCURRENCY))
                .timeout(ObjectUtils.defaultIfNull(createJobRequest.getTimeout(), SyncJobEntity.DEFAULT_TIMEOUT_SEC))
                .retries(ObjectUtils.defaultIfNull(createJobRequest.getRetries(), SyncJobEntity.DEFAULT_RETRIES))
                .status(JobStatusEnum.IDLE)
                .nextRun(this.clock.instant().plus(Duration.ofMinutes(intervalMinutes)))
                .build();
        this.syncJobStore.put(job);
        this.syncJobStore.persist();
        log.info("job created. job is {}", jobId);
        this.activityLogService.info(job, "Job \"%s\" created".formatted(job.getName()));
        this.jobNotifier.publishJobs();
        return this.jobNotifier.snapshot(job);
    }

    // id 不存在返回 null
    public SyncJobEntity updateJob(String jobId, UpdateJobRequest updateJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(updateJobRequest)) {
            throw new ValidationException("updateJob failed. updateJobRequest is null");
        }
        SyncJobEntity job = this.syncJobStore.get(jobId);
        if (ObjectUtils.isEmpty(job)) {
            return null;
        }
        synchronized (job) {
            if (StringUtils.isNotBlank(updateJobRequest.getName())) {
                job.setName(updateJobRequest.getName());
            }
            if (StringUtils.isNotBlank(updateJobRequest.getSource())) {
                job.setSource(updateJobRequest.getSource());
            }
            if (StringUtils.isNotBlank(updateJobRequest.getDestination())) {
                job.setDestination(updateJobRequest.getDestination());
            }
            if (ObjectUtils.isNotEmpty(updateJobRequest.getConcurrency())) {
                job.setConcurrency(updateJobRequest.getConcurrency());
            }
            if (ObjectUtils.isNotEmpty(updateJobRequest.getTimeout())) {
                job.setTimeout(updateJobRequest.getTimeout());
            }
            if (ObjectUtils.isNotEmpty(updateJobRequest.getRetries())) {
                job.setRetries(updateJobRequest.getRetries());
            }
            if (ObjectUtils.isNotEmpty(updateJobRequest.getIntervalMinutes())) {
                job.setIntervalMinutes(updateJobRequest.getIntervalMinutes());
                // 周期变化后重新计算下一次运行
                Instant base = ObjectUtils.defaultIfNull(job.getLastRun(), this.clock.instant());
                job.setNextRun(base.plus(job.intervalDuration()));
            }
        }
        this.syncJobStore.persist();
        log.info("job updated. job is {}", jobId);
        this.activityLogService.info(job, "Job \"%s\" updated".formatted(job.getName()));
        this.jobNotifier.publishJobs();
        return this.jobNotifier.snapshot(job);
    }

    public boolean removeJob(String jobId) {
        SyncJobEntity job = this.syncJobStore.get(jobId);
        if (ObjectUtils.isEmpty(job)) {
            return false;
        }
        // 先停止进程
        this.stopJob(jobId);
        this.syncJobStore.remove(jobId);
        this.analyticsService.remove(jobId);
        this.syncJobStore.persist();
        log.info("job deleted. job is {}", jobId);
        this.activityLogService.info(job, "Job \"%s\" deleted".formatted(job.getName()));
        this.jobNotifier.publishJobs();
        return true;
    }

    public boolean runNow(String jobId) {
        SyncJobEntity job = this.syncJobStore.get(jobId);
        if (ObjectUtils.isEmpty(job)) {
            return false;
        }
        return this.trigger(job);
    }

    // 非阻塞, job 已经在运行则返回 false
    public boolean trigger(SyncJobEntity job) {
        SupervisedProcess supervisedProcess = this.processRegistry.tryClaim(job.getId());
        if (ObjectUtils.isEmpty(supervisedProcess)) {
            log.debug("trigger skipped. job is already running. job is {}", job.getId());
            return false;
        }
        try {
            this.jobTaskExecutor.execute(() -> this.syncJobExecutor.executeJob(job, supervisedProcess));
        } catch (RuntimeException e) {
            log.error("trigger failed. dispatch rejected. job is {}", job.getId(), e);
            this.processRegistry.release(supervisedProcess);
            return false;
        }
        return true;
    }

    public boolean stopJob(String jobId) {
        SupervisedProcess supervisedProcess = this.processRegistry.get(jobId);
        if (ObjectUtils.isEmpty(supervisedProcess)) {
            return false;
        }
        supervisedProcess.terminate();
        SyncJobEntity job = this.syncJobStore.get(jobId);
        if (ObjectUtils.isNotEmpty(job)) {
            markStopped(job);
            this.syncJobStore.persist();
            log.info("job stopped by user. job is {}", jobId);
            this.activityLogService.warning(job, "Job \"%s\" stopped by user".formatted(job.getName()));
            this.jobNotifier.publishJobs();
        }
        return true;
    }

    public List<SyncJobEntity> getJobs() {
        return this.jobNotifier.snapshotAll();
    }

    public SyncJobEntity getJob(String jobId) {
        return this.jobNotifier.snapshot(this.syncJobStore.get(jobId));
    }

    public List<ActivityLogEntity> getActivityLog(Integer limit) {
        return this.activityLogService.getActivityLog(limit);
    }

    public void clearActivityLog() {
        this.activityLogService.clear();
    }

    public SyncStats getStats() {
        return this.statsService.getStats();
    }

    public CompletableFuture<Boolean> checkDiff(String jobId) {
        return this.diffChecker.checkDiff(jobId);
    }

    // 网络恢复时把 error 的 job 恢复为 idle
    public int rearmFailedJobs() {
        int count = 0;
        Instant now = this.clock.instant();
        for (SyncJobEntity job : this.syncJobStore.getAll()) {
            synchronized (job) {
                if (job.getStatus() != JobStatusEnum.ERROR) {
                    continue;
                }
                job.setStatus(JobStatusEnum.IDLE);
                job.setNextRun(now);
            }
            count++;
        }
        if (count > 0) {
            log.info("{} failed jobs re-armed", count);
            this.syncJobStore.persist();
            this.jobNotifier.publishJobs();
        }
        return count;
    }

    // 不看周期, 所有不在运行的 job 立即执行一次
    public int fireOnBoot() {
        log.info("triggering immediate sync for all jobs");
        int count = 0;
        for (SyncJobEntity job : this.syncJobStore.getAll()) {
            if (this.trigger(job)) {
                count++;
            }
        }
        return count;
    }

    public void shutdown() {
        List<SupervisedProcess> supervisedProcesses = this.processRegistry.getAll();
        if (CollectionUtils.isEmpty(supervisedProcesses)) {
            return;
        }
        log.info("shutdown. stopping {} running jobs", supervisedProcesses.size());
        List<CompletableFuture<Void>> settledFutures = new ArrayList<>();
        for (SupervisedProcess supervisedProcess : supervisedProcesses) {
            supervisedProcess.terminate();
            settledFutures.add(supervisedProcess.getSettled());
            SyncJobEntity job = this.syncJobStore.get(supervisedProcess.getJobId());
            if (ObjectUtils.isNotEmpty(job)) {
                markStopped(job);
            }
        }
        this.syncJobStore.persist();
        CompletableFuture<Void> allSettled = CompletableFuture.allOf(
                settledFutures.toArray(new CompletableFuture[0]));
        try {
            allSettled.get(this.systemSettings.getShutdown().getGraceSec(), TimeUnit.SECONDS);
            log.info("shutdown. all jobs stopped");
        } catch (TimeoutException e) {
            log.warn("shutdown. grace period elapsed, force killing remaining rclone processes");
            for (SupervisedProcess supervisedProcess : supervisedProcesses) {
                supervisedProcess.forceKill();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("shutdown interrupted. force killing remaining rclone processes");
            for (SupervisedProcess supervisedProcess : supervisedProcesses) {
                supervisedProcess.forceKill();
            }
        } catch (ExecutionException e) {
            log.warn("shutdown failed.", e);
        }
    }

    private static void markStopped(SyncJobEntity job) {
        synchronized (job) {
            job.resetProgress();
            job.setStatus(JobStatusEnum.IDLE);
        }
    }
}
