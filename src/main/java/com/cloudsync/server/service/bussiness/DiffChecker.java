package com.cloudsync.server.service.bussiness;

import com.cloudsync.server.enums.DiffStatusEnum;
import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.rclone.global.RcloneExecResult;
import com.cloudsync.server.service.cache.ProcessRegistry;
import com.cloudsync.server.service.db.SyncJobStore;
import com.cloudsync.server.service.rclone.RcloneFacadeService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Pre-flight {@code rclone check --one-way}. Exit 0 means in sync, exit 1 means differences;
 * both are successful checks. {@code pendingChanges} is a 0/1 flag, not a file count.
 */
@Service
@Slf4j
public class DiffChecker {

    private final RcloneFacadeService rcloneFacadeService;

    private final ProcessRegistry processRegistry;

    private final SyncJobStore syncJobStore;

    private final JobNotifier jobNotifier;

    private final Clock clock;

    @Autowired
    public DiffChecker(
            RcloneFacadeService rcloneFacadeService,
            ProcessRegistry processRegistry,
            SyncJobStore syncJobStore,
            JobNotifier jobNotifier,
            Clock clock) {
        this.rcloneFacadeService = rcloneFacadeService;
        this.processRegistry = processRegistry;
        this.syncJobStore = syncJobStore;
        this.jobNotifier = jobNotifier;
        this.clock = clock;
    }

    // true 表示有差异
    public CompletableFuture<Boolean> checkDiff(String jobId) {
        SyncJobEntity job = this.syncJobStore.get(jobId);
        if (ObjectUtils.isEmpty(job)) {
            return CompletableFuture.completedFuture(false);
        }
        synchronized (job) {
            if (this.processRegistry.isActive(jobId)
                    || job.getStatus() == JobStatusEnum.RUNNING
                    || job.getDiffStatus() == DiffStatusEnum.CHECKING) {
                return CompletableFuture.completedFuture(false);
            }
            job.setDiffStatus(DiffStatusEnum.CHECKING);
        }
        this.jobNotifier.publishJobs();
        log.info("performing diff check. job is {}", jobId);
        CompletableFuture<RcloneExecResult> checkFuture;
        try {
            checkFuture = this.rcloneFacadeService.oneWayCheck(job);
        } catch (RuntimeException e) {
            checkFuture = CompletableFuture.failedFuture(e);
        }
        return checkFuture.handle((result, ex) -> {
            boolean different = false;
            synchronized (job) {
                job.setLastDiffCheck(this.clock.instant());
                if (ObjectUtils.isNotEmpty(ex) || !result.isSuccess()) {
                    job.setDiffStatus(DiffStatusEnum.ERROR);
                    log.warn("diff check failed. job is {}. {}",
                            jobId,
                            ObjectUtils.isNotEmpty(ex) ? ex.getMessage() : result.getErrorSummary());
                } else if (result.getExitCode() == 0) {
                    job.setDiffStatus(DiffStatusEnum.SYNCED);
                    job.setPendingChanges(0);
                    log.info("diff check complete, in sync. job is {}", jobId);
                } else {
                    job.setDiffStatus(DiffStatusEnum.DIFFERENT);
                    job.setPendingChanges(1);
                    different = true;
                    log.info("diff check complete, differences detected. job is {}", jobId);
                }
            }
            this.syncJobStore.persist();
            this.jobNotifier.publishJobs();
            return different;
        });
    }
}
