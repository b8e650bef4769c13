package com.cloudsync.server.service.db;

import com.cloudsync.server.exception.CloudSyncException;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.AnalyticsEntity;
import com.cloudsync.server.util.JsonUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

@Service
@Slf4j
public class AnalyticsService {

    private static final String ANALYTICS_FILE = "analytics.json";

    private static final double PREVIOUS_WEIGHT = 0.7;

    private static final double SAMPLE_WEIGHT = 0.3;

    // <jobId, analytics>
    private final Map<String, AnalyticsEntity> analytics = new HashMap<>();

    private final SystemSettings systemSettings;

    @Autowired
    public AnalyticsService(SystemSettings systemSettings) {
        this.systemSettings = systemSettings;
    }

    public synchronized void init() {
        Map<String, AnalyticsEntity> loaded;
        try {
            loaded = JsonUtil.readJsonFile(this.getFile(), new TypeReference<Map<String, AnalyticsEntity>>() {});
        } catch (CloudSyncException e) {
            log.warn("load analytics failed, start empty. file is {}", this.getFile(), e);
            loaded = null;
        }
        this.analytics.clear();
        if (MapUtils.isNotEmpty(loaded)) {
            this.analytics.putAll(loaded);
        }
    }

    public synchronized void recordSuccess(String jobId, long bytes, double speed) {
        AnalyticsEntity entity = this.getOrCreate(jobId);
        entity.setSuccessCount(entity.getSuccessCount() + 1);
        entity.setTotalBytes(entity.getTotalBytes() + bytes);
        // 第一次直接取值
        entity.setAvgSpeed(entity.getAvgSpeed() == 0 ?
                speed :
                entity.getAvgSpeed() * PREVIOUS_WEIGHT + speed * SAMPLE_WEIGHT);
        this.persist();
    }

    public synchronized void recordError(String jobId) {
        AnalyticsEntity entity = this.getOrCreate(jobId);
        entity.setErrorCount(entity.getErrorCount() + 1);
        this.persist();
    }

    public synchronized AnalyticsEntity get(String jobId) {
        AnalyticsEntity entity = this.analytics.get(jobId);
        return ObjectUtils.isEmpty(entity) ? null : entity.copy();
    }

    // job 删除时一并删除
    public synchronized void remove(String jobId) {
        if (ObjectUtils.isEmpty(this.analytics.remove(jobId))) {
            return;
        }
        this.persist();
    }

    private AnalyticsEntity getOrCreate(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            throw new IllegalArgumentException("jobId is blank");
        }
        return this.analytics.computeIfAbsent(jobId, k -> new AnalyticsEntity());
    }

    private void persist() {
        try {
            JsonUtil.writeJsonFile(this.getFile(), new HashMap<>(this.analytics));
        } catch (CloudSyncException e) {
            log.warn("persist analytics failed. file is {}", this.getFile(), e);
        }
    }

    private Path getFile() {
        return Paths.get(this.systemSettings.getData().getFolderPath(), ANALYTICS_FILE);
    }
}
