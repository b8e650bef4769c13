package com.cloudsync.server.service.db;

import com.cloudsync.server.enums.ActivityTypeEnum;
import com.cloudsync.server.exception.CloudSyncException;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.ActivityLogEntity;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.internal.ActivityClearedEvent;
import com.cloudsync.server.model.internal.ActivityLoggedEvent;
import com.cloudsync.server.util.JsonUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.RandomStringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded activity ledger backed by {@code activity.json}, oldest first in memory and on disk.
 * <p>
 * Progress entries are kept in memory and reach disk with the next non-progress entry.
 */
@Service
@Slf4j
public class ActivityLogService {

    private static final String ACTIVITY_FILE = "activity.json";

    // 头部最旧, 尾部最新
    private final Deque<ActivityLogEntity> entries = new ArrayDeque<>();

    private final SystemSettings systemSettings;

    private final ApplicationEventPublisher applicationEventPublisher;

    private final Clock clock;

    @Autowired
    public ActivityLogService(
            SystemSettings systemSettings,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.systemSettings = systemSettings;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public synchronized void init() {
        List<ActivityLogEntity> loaded;
        try {
            loaded = JsonUtil.readJsonFile(this.getFile(), new TypeReference<List<ActivityLogEntity>>() {});
        } catch (CloudSyncException e) {
            log.warn("load activity log failed, start empty. file is {}", this.getFile(), e);
            loaded = null;
        }
        this.entries.clear();
        if (CollectionUtils.isNotEmpty(loaded)) {
            this.entries.addAll(loaded);
            this.evict();
        }
    }

    public ActivityLogEntity info(SyncJobEntity job, String message) {
        return this.log(ActivityTypeEnum.INFO, job, message, null);
    }

    public ActivityLogEntity warning(SyncJobEntity job, String message) {
        return this.log(ActivityTypeEnum.WARNING, job, message, null);
    }

    public ActivityLogEntity error(SyncJobEntity job, String message) {
        return this.log(ActivityTypeEnum.ERROR, job, message, null);
    }

    public ActivityLogEntity log(
            ActivityTypeEnum type,
            SyncJobEntity job,
            String message,
            ActivityLogEntity.ActivityDetails details) {
        long now = this.clock.millis();
        ActivityLogEntity entry = ActivityLogEntity.builder()
                .id(now + "-" + RandomStringUtils.randomAlphanumeric(8))
                .timestamp(this.clock.instant())
                .type(ObjectUtils.defaultIfNull(type, ActivityTypeEnum.INFO))
                .jobId(ObjectUtils.isEmpty(job) ? null : job.getId())
                .jobName(ObjectUtils.isEmpty(job) ? null : job.getName())
                .message(message)
                .details(details)
                .build();
        synchronized (this) {
            this.entries.addLast(entry);
            this.evict();
            if (entry.getType() != ActivityTypeEnum.PROGRESS) {
                this.persist();
            }
        }
        this.applicationEventPublisher.publishEvent(new ActivityLoggedEvent(entry));
        return entry;
    }

    // newest first
    public synchronized List<ActivityLogEntity> getActivityLog(Integer limit) {
        int size = ObjectUtils.isEmpty(limit) || limit <= 0 ?
                this.systemSettings.getActivityLog().getDefaultLimit() :
                limit;
        List<ActivityLogEntity> result = new ArrayList<>(Math.min(size, this.entries.size()));
        Iterator<ActivityLogEntity> iterator = this.entries.descendingIterator();
        while (iterator.hasNext() && result.size() < size) {
            result.add(iterator.next());
        }
        return result;
    }

    public synchronized int size() {
        return this.entries.size();
    }

    public void clear() {
        synchronized (this) {
            this.entries.clear();
            this.persist();
        }
        this.applicationEventPublisher.publishEvent(new ActivityClearedEvent());
    }

    private void evict() {
        int maxEntries = this.systemSettings.getActivityLog().getMaxEntries();
        while (this.entries.size() > maxEntries) {
            this.entries.pollFirst();
        }
    }

    private void persist() {
        try {
            JsonUtil.writeJsonFile(this.getFile(), new ArrayList<>(this.entries));
        } catch (CloudSyncException e) {
            log.warn("persist activity log failed. file is {}", this.getFile(), e);
        }
    }

    private Path getFile() {
        return Paths.get(this.systemSettings.getData().getFolderPath(), ACTIVITY_FILE);
    }
}
