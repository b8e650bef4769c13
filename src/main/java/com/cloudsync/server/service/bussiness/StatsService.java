package com.cloudsync.server.service.bussiness;

import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.model.api.stats.StorageStats;
import com.cloudsync.server.model.api.stats.SyncStats;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.internal.StatsUpdatedEvent;
import com.cloudsync.server.model.rclone.operations.about.AboutResponse;
import com.cloudsync.server.model.rclone.remote.RcloneRemote;
import com.cloudsync.server.service.cache.ProcessRegistry;
import com.cloudsync.server.service.db.SyncJobStore;
import com.cloudsync.server.service.rclone.RcloneFacadeService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class StatsService {

    private final RcloneFacadeService rcloneFacadeService;

    private final SyncJobStore syncJobStore;

    private final ProcessRegistry processRegistry;

    private final ApplicationEventPublisher applicationEventPublisher;

    // about 比较慢, 单独刷新
    private volatile StorageStats storageStats;

    @Autowired
    public StatsService(
            RcloneFacadeService rcloneFacadeService,
            SyncJobStore syncJobStore,
            ProcessRegistry processRegistry,
            ApplicationEventPublisher applicationEventPublisher) {
        this.rcloneFacadeService = rcloneFacadeService;
        this.syncJobStore = syncJobStore;
        this.processRegistry = processRegistry;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public SyncStats getStats() {
        double speed = 0;
        long bytes = 0;
        long transfers = 0;
        for (SyncJobEntity job : this.syncJobStore.getAll()) {
            synchronized (job) {
                if (job.getStatus() != JobStatusEnum.RUNNING) {
                    continue;
                }
                speed += job.getSpeed();
                bytes += job.getBytesTransferred();
                transfers += job.getFilesTransferred();
            }
        }
        return new SyncStats(speed, bytes, transfers, this.processRegistry.supervisedCount(), this.storageStats);
    }

    public StorageStats getStorageStats() {
        return this.storageStats;
    }

    // initial delay 5 minutes, 启动时由 ApplicationLifeCycleConfig 刷新一次
    @Scheduled(
            initialDelayString = "${cloudsync.server.stats.refresh-interval-millis:300000}",
            fixedDelayString = "${cloudsync.server.stats.refresh-interval-millis:300000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void refreshStorageStats() {
        try {
            List<RcloneRemote> remotes = this.rcloneFacadeService.listRemotes().join();
            String remoteName = this.rcloneFacadeService.pickStorageRemote(remotes);
            if (ObjectUtils.isEmpty(remoteName)) {
                log.debug("refreshStorageStats skipped. no remote configured");
                return;
            }
            AboutResponse aboutResponse = this.rcloneFacadeService.about(remoteName).join();
            if (ObjectUtils.isEmpty(aboutResponse)
                    || ObjectUtils.isEmpty(aboutResponse.getTotal())
                    || aboutResponse.getTotal() <= 0) {
                log.debug("refreshStorageStats skipped. remote {} reports no quota", remoteName);
                return;
            }
            this.storageStats = toStorageStats(aboutResponse);
            log.info("storage stats refreshed. remote is {}. {}", remoteName, this.storageStats);
        } catch (RuntimeException e) {
            log.warn("refreshStorageStats failed.", e);
            return;
        }
        this.applicationEventPublisher.publishEvent(new StatsUpdatedEvent(this.getStats()));
    }

    static StorageStats toStorageStats(AboutResponse aboutResponse) {
        long total = aboutResponse.getTotal();
        long used = ObjectUtils.defaultIfNull(aboutResponse.getUsed(), 0L);
        long free = ObjectUtils.isEmpty(aboutResponse.getFree()) ?
                Math.max(0, total - used) :
                aboutResponse.getFree();
        int percent = (int) Math.round(used * 100.0 / total);
        return new StorageStats(total, used, free, percent);
    }
}
