package com.cloudsync.server.controller;

import com.cloudsync.server.exception.ResourceNotFoundException;
import com.cloudsync.server.model.api.global.CloudSyncHttpResponse;
import com.cloudsync.server.model.api.job.CreateJobRequest;
import com.cloudsync.server.model.api.job.UpdateJobRequest;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.service.facade.SyncJobOrchestrator;
import com.cloudsync.server.util.EntityValidationUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/jobs")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class JobController {

    private final SyncJobOrchestrator syncJobOrchestrator;

    @Autowired
    public JobController(SyncJobOrchestrator syncJobOrchestrator) {
        this.syncJobOrchestrator = syncJobOrchestrator;
    }

    @GetMapping
    public CloudSyncHttpResponse<List<SyncJobEntity>> getJobs() {
        return CloudSyncHttpResponse.success(this.syncJobOrchestrator.getJobs());
    }

    @GetMapping("/{id}")
    public CloudSyncHttpResponse<SyncJobEntity> getJob(@PathVariable("id") String id) {
        return CloudSyncHttpResponse.success(this.getJobOrThrow(id));
    }

    @PostMapping
    public CloudSyncHttpResponse<SyncJobEntity> addJob(@RequestBody CreateJobRequest createJobRequest) {
        // 参数检查
        EntityValidationUtil.isCreateJobRequestValid(createJobRequest);
        return CloudSyncHttpResponse.success(this.syncJobOrchestrator.addJob(createJobRequest));
    }

    @PutMapping("/{id}")
    public CloudSyncHttpResponse<SyncJobEntity> updateJob(
            @PathVariable("id") String id,
            @RequestBody UpdateJobRequest updateJobRequest) {
        EntityValidationUtil.isUpdateJobRequestValid(updateJobRequest);
        SyncJobEntity updated = this.syncJobOrchestrator.updateJob(id, updateJobRequest);
        if (ObjectUtils.isEmpty(updated)) {
            throw new ResourceNotFoundException("updateJob failed. job %s not found".formatted(id));
        }
        return CloudSyncHttpResponse.success(updated);
    }

    @DeleteMapping("/{id}")
    public CloudSyncHttpResponse<Void> removeJob(@PathVariable("id") String id) {
        if (!this.syncJobOrchestrator.removeJob(id)) {
            throw new ResourceNotFoundException("removeJob failed. job %s not found".formatted(id));
        }
        return CloudSyncHttpResponse.success();
    }

    @PostMapping("/{id}/run")
    public CloudSyncHttpResponse<Boolean> runNow(@PathVariable("id") String id) {
        this.getJobOrThrow(id);
        boolean started = this.syncJobOrchestrator.runNow(id);
        return CloudSyncHttpResponse.success(started, started ? "Job started" : "Job is already running");
    }

    @PostMapping("/{id}/stop")
    public CloudSyncHttpResponse<Boolean> stopJob(@PathVariable("id") String id) {
        this.getJobOrThrow(id);
        boolean stopped = this.syncJobOrchestrator.stopJob(id);
        return CloudSyncHttpResponse.success(stopped, stopped ? "Job stopped" : "Job is not running");
    }

    // true 表示有差异
    @PostMapping("/{id}/check")
    public CompletableFuture<CloudSyncHttpResponse<Boolean>> checkDiff(@PathVariable("id") String id) {
        this.getJobOrThrow(id);
        return this.syncJobOrchestrator.checkDiff(id).thenApply(CloudSyncHttpResponse::success);
    }

    private SyncJobEntity getJobOrThrow(String id) {
        SyncJobEntity job = this.syncJobOrchestrator.getJob(id);
        if (ObjectUtils.isEmpty(job)) {
            throw new ResourceNotFoundException("job %s not found".formatted(id));
        }
        return job;
    }
}
