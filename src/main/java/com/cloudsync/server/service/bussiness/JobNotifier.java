package com.cloudsync.server.service.bussiness;

import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.internal.JobsUpdatedEvent;
import com.cloudsync.server.service.db.AnalyticsService;
import com.cloudsync.server.service.db.SyncJobStore;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

// job 快照, 合并 analytics
@Service
public class JobNotifier {

    private final SyncJobStore syncJobStore;

    private final AnalyticsService analyticsService;

    private final ApplicationEventPublisher applicationEventPublisher;

    @Autowired
    public JobNotifier(
            SyncJobStore syncJobStore,
            AnalyticsService analyticsService,
            ApplicationEventPublisher applicationEventPublisher) {
        this.syncJobStore = syncJobStore;
        this.analyticsService = analyticsService;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public SyncJobEntity snapshot(SyncJobEntity job) {
        if (ObjectUtils.isEmpty(job)) {
            return null;
        }
        return job.snapshot(this.analyticsService.get(job.getId()));
    }

    public List<SyncJobEntity> snapshotAll() {
        List<SyncJobEntity> result = new ArrayList<>();
        for (SyncJobEntity job : this.syncJobStore.getAll()) {
            result.add(this.snapshot(job));
        }
        return result;
    }

    public void publishJobs() {
        this.applicationEventPublisher.publishEvent(new JobsUpdatedEvent(this.snapshotAll()));
    }
}
