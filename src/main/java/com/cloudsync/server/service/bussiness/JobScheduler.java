package com.cloudsync.server.service.bussiness;

import com.cloudsync.server.enums.DiffStatusEnum;
import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.enums.TriggerPolicyEnum;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.internal.ConnectivityChangedEvent;
import com.cloudsync.server.service.cache.ProcessRegistry;
import com.cloudsync.server.service.db.ActivityLogService;
import com.cloudsync.server.service.db.SyncJobStore;
import com.cloudsync.server.service.facade.SyncJobOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
public class JobScheduler {

    private final SyncJobOrchestrator syncJobOrchestrator;

    private final SyncJobStore syncJobStore;

    private final ProcessRegistry processRegistry;

    private final ActivityLogService activityLogService;

    private final ConnectivityMonitor connectivityMonitor;

    private final SystemSettings systemSettings;

    private final Clock clock;

    @Autowired
    public JobScheduler(
            SyncJobOrchestrator syncJobOrchestrator,
            SyncJobStore syncJobStore,
            ProcessRegistry processRegistry,
            ActivityLogService activityLogService,
            ConnectivityMonitor connectivityMonitor,
            SystemSettings systemSettings,
            Clock clock) {
        this.syncJobOrchestrator = syncJobOrchestrator;
        this.syncJobStore = syncJobStore;
        this.processRegistry = processRegistry;
        this.activityLogService = activityLogService;
        this.connectivityMonitor = connectivityMonitor;
        this.systemSettings = systemSettings;
        this.clock = clock;
    }

    // fixDelay 1 minute. unit is millisecond
    @Scheduled(
            initialDelayString = "${cloudsync.server.scheduler.interval-millis:60000}",
            fixedDelayString = "${cloudsync.server.scheduler.interval-millis:60000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void tick() {
        if (!this.connectivityMonitor.isOnline()) {
            log.debug("scheduler tick skipped. offline");
            return;
        }
        Instant now = this.clock.instant();
        for (SyncJobEntity job : this.syncJobStore.getAll()) {
            // 单个 job 的异常不影响其他 job
            try {
                this.evaluate(job, now);
            } catch (RuntimeException e) {
                log.error("scheduler tick failed. job is {}", job.getId(), e);
            }
        }
    }

    private void evaluate(SyncJobEntity job, Instant now) {
        if (this.processRegistry.isActive(job.getId())) {
            return;
        }
        Instant dueTime;
        synchronized (job) {
            if (job.getStatus() == JobStatusEnum.RUNNING || job.getDiffStatus() == DiffStatusEnum.CHECKING) {
                return;
            }
            dueTime = computeDueTime(job);
        }
        if (ObjectUtils.isEmpty(dueTime) || !now.isBefore(dueTime)) {
            log.info("recurring sync cycle reached. job is {}", job.getId());
            this.activityLogService.info(job, "Recurring sync cycle reached. Verifying integrity...");
            this.syncJobOrchestrator.trigger(job);
            return;
        }
        if (this.systemSettings.getScheduler().getTriggerPolicy() != TriggerPolicyEnum.INTERVAL_OR_DIFF) {
            return;
        }
        this.syncJobOrchestrator.checkDiff(job.getId()).thenAccept(different -> {
            if (!different) {
                return;
            }
            this.activityLogService.info(job, "Differences detected. Starting sync ahead of schedule.");
            this.syncJobOrchestrator.trigger(job);
        });
    }

    /**
     * lastRun + interval. A job that never ran uses its stored nextRun; a failed job waits for
     * the nextRun set at failure before it is retried.
     */
    static Instant computeDueTime(SyncJobEntity job) {
        Instant dueTime = ObjectUtils.isEmpty(job.getLastRun()) ?
                job.getNextRun() :
                job.getLastRun().plus(job.intervalDuration());
        if (job.getStatus() == JobStatusEnum.ERROR
                && ObjectUtils.allNotNull(dueTime, job.getNextRun())
                && job.getNextRun().isAfter(dueTime)) {
            dueTime = job.getNextRun();
        }
        return dueTime;
    }

    @EventListener
    public void onConnectivityChanged(ConnectivityChangedEvent event) {
        if (!event.isOnline()) {
            this.activityLogService.warning(null, "Network connectivity lost. Scheduled syncs paused.");
            return;
        }
        this.activityLogService.info(null, "Network connectivity restored. Resuming scheduled syncs.");
        this.syncJobOrchestrator.rearmFailedJobs();
        this.syncJobOrchestrator.fireOnBoot();
    }
}
