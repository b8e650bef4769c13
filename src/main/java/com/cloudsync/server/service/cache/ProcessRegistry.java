package com.cloudsync.server.service.cache;

import com.cloudsync.server.service.rclone.SupervisedProcess;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The only record of which jobs own an rclone process. A job is claimed before its
 * preconditions are probed and released once its run is finalized, so at most one
 * run per job id can be in flight.
 */
@Service
@Slf4j
public class ProcessRegistry {

    // <jobId, SupervisedProcess>
    private final Map<String, SupervisedProcess> processes = new ConcurrentHashMap<>();

    // null 表示已经被占用
    public SupervisedProcess tryClaim(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            return null;
        }
        SupervisedProcess candidate = new SupervisedProcess(jobId);
        SupervisedProcess existing = this.processes.putIfAbsent(jobId, candidate);
        return ObjectUtils.isEmpty(existing) ? candidate : null;
    }

    public SupervisedProcess get(String jobId) {
        if (StringUtils.isBlank(jobId)) {
            return null;
        }
        return this.processes.get(jobId);
    }

    public boolean isActive(String jobId) {
        return ObjectUtils.isNotEmpty(this.get(jobId));
    }

    // claimed and rclone already spawned
    public boolean isSupervised(String jobId) {
        SupervisedProcess supervisedProcess = this.get(jobId);
        return ObjectUtils.isNotEmpty(supervisedProcess) && supervisedProcess.isSpawned();
    }

    // 只释放自己持有的那一个
    public void release(SupervisedProcess supervisedProcess) {
        if (ObjectUtils.isEmpty(supervisedProcess)) {
            return;
        }
        boolean removed = this.processes.remove(supervisedProcess.getJobId(), supervisedProcess);
        supervisedProcess.markSettled();
        if (!removed) {
            log.warn("release failed. handle is not registered. jobId is {}", supervisedProcess.getJobId());
        }
    }

    public int supervisedCount() {
        int count = 0;
        for (SupervisedProcess supervisedProcess : this.processes.values()) {
            if (supervisedProcess.isSpawned()) {
                count++;
            }
        }
        return count;
    }

    public List<SupervisedProcess> getAll() {
        return new ArrayList<>(this.processes.values());
    }
}
