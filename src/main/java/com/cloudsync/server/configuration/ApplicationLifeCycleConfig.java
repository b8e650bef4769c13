package com.cloudsync.server.configuration;

import com.cloudsync.server.service.bussiness.ConnectivityMonitor;
import com.cloudsync.server.service.bussiness.StatsService;
import com.cloudsync.server.service.db.ActivityLogService;
import com.cloudsync.server.service.db.AnalyticsService;
import com.cloudsync.server.service.db.SyncJobStore;
import com.cloudsync.server.service.facade.SyncJobOrchestrator;
import com.cloudsync.server.service.rclone.RcloneFacadeService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    private final SyncJobStore syncJobStore;

    private final ActivityLogService activityLogService;

    private final AnalyticsService analyticsService;

    private final RcloneFacadeService rcloneFacadeService;

    private final ConnectivityMonitor connectivityMonitor;

    private final StatsService statsService;

    private final SyncJobOrchestrator syncJobOrchestrator;

    private final ThreadPoolTaskScheduler systemManagementTaskScheduler;

    @Autowired
    public ApplicationLifeCycleConfig(
            SyncJobStore syncJobStore,
            ActivityLogService activityLogService,
            AnalyticsService analyticsService,
            RcloneFacadeService rcloneFacadeService,
            ConnectivityMonitor connectivityMonitor,
            StatsService statsService,
            SyncJobOrchestrator syncJobOrchestrator,
            @Qualifier("systemManagementTaskScheduler") ThreadPoolTaskScheduler systemManagementTaskScheduler) {
        this.syncJobStore = syncJobStore;
        this.activityLogService = activityLogService;
        this.analyticsService = analyticsService;
        this.rcloneFacadeService = rcloneFacadeService;
        this.connectivityMonitor = connectivityMonitor;
        this.statsService = statsService;
        this.syncJobOrchestrator = syncJobOrchestrator;
        this.systemManagementTaskScheduler = systemManagementTaskScheduler;
    }

    // 等待 listener 全部注册后再启动, ConnectivityChangedEvent 才有人接收
    @EventListener(ApplicationReadyEvent.class)
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        this.syncJobStore.init();
        this.activityLogService.init();
        this.analyticsService.init();
        this.rcloneFacadeService.init();
        this.connectivityMonitor.checkConnectivity();
        // 系统启动, 所有 job 立即执行一次
        this.syncJobOrchestrator.fireOnBoot();
        // about 很慢, 不阻塞启动
        this.systemManagementTaskScheduler.execute(this.statsService::refreshStorageStats);
    }

    @PreDestroy
    public void shutDown() {
        this.syncJobOrchestrator.shutdown();
    }
}
