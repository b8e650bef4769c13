package com.cloudsync.server.service.db;

import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.exception.CloudSyncException;
import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.util.JsonUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory job table backed by {@code jobs.json}. Memory is authoritative; a failed write is
 * logged and the next mutation tries again.
 */
@Service
@Slf4j
public class SyncJobStore {

    private static final String JOBS_FILE = "jobs.json";

    // <jobId, job>, 保持插入顺序
    private final Map<String, SyncJobEntity> jobs = new LinkedHashMap<>();

    private final Object persistLock = new Object();

    private final SystemSettings systemSettings;

    @Autowired
    public SyncJobStore(SystemSettings systemSettings) {
        this.systemSettings = systemSettings;
    }

    public void init() {
        List<SyncJobEntity> loaded;
        try {
            loaded = JsonUtil.readJsonFile(this.getFile(), new TypeReference<List<SyncJobEntity>>() {});
        } catch (CloudSyncException e) {
            log.warn("load jobs failed, start with empty job list. file is {}", this.getFile(), e);
            loaded = null;
        }
        synchronized (this.jobs) {
            this.jobs.clear();
            if (CollectionUtils.isEmpty(loaded)) {
                log.info("no job loaded. file is {}", this.getFile());
                return;
            }
            for (SyncJobEntity job : loaded) {
                if (ObjectUtils.isEmpty(job) || StringUtils.isBlank(job.getId())) {
                    continue;
                }
                // 上次进程退出时还在运行, 不可能还有对应的 rclone
                if (job.getStatus() == JobStatusEnum.RUNNING || ObjectUtils.isEmpty(job.getStatus())) {
                    job.setStatus(JobStatusEnum.IDLE);
                    job.resetProgress();
                }
                this.jobs.put(job.getId(), job);
            }
            log.info("{} jobs loaded from {}", this.jobs.size(), this.getFile());
        }
    }

    public SyncJobEntity get(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            return null;
        }
        synchronized (this.jobs) {
            return this.jobs.get(jobId);
        }
    }

    public boolean contains(String jobId) {
        return ObjectUtils.isNotEmpty(this.get(jobId));
    }

    public List<SyncJobEntity> getAll() {
        synchronized (this.jobs) {
            return new ArrayList<>(this.jobs.values());
        }
    }

    public void put(SyncJobEntity job) throws ValidationException {
        if (ObjectUtils.isEmpty(job) || StringUtils.isBlank(job.getId())) {
            throw new ValidationException("put job failed. job or jobId is null");
        }
        synchronized (this.jobs) {
            this.jobs.put(job.getId(), job);
        }
    }

    public SyncJobEntity remove(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            return null;
        }
        synchronized (this.jobs) {
            return this.jobs.remove(jobId);
        }
    }

    // 全量覆盖写入
    public void persist() {
        synchronized (this.persistLock) {
            List<SyncJobEntity> snapshot = new ArrayList<>();
            for (SyncJobEntity job : this.getAll()) {
                snapshot.add(job.persistentCopy());
            }
            try {
                JsonUtil.writeJsonFile(this.getFile(), snapshot);
            } catch (CloudSyncException e) {
                log.warn("persist jobs failed. file is {}", this.getFile(), e);
            }
        }
    }

    private Path getFile() {
        return Paths.get(this.systemSettings.getData().getFolderPath(), JOBS_FILE);
    }
}
