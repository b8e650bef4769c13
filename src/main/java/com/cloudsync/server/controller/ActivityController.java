package com.cloudsync.server.controller;

import com.cloudsync.server.model.api.global.CloudSyncHttpResponse;
import com.cloudsync.server.model.entity.ActivityLogEntity;
import com.cloudsync.server.service.facade.SyncJobOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/activity")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class ActivityController {

    private final SyncJobOrchestrator syncJobOrchestrator;

    @Autowired
    public ActivityController(SyncJobOrchestrator syncJobOrchestrator) {
        this.syncJobOrchestrator = syncJobOrchestrator;
    }

    @GetMapping
    public CloudSyncHttpResponse<List<ActivityLogEntity>> getActivityLog(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return CloudSyncHttpResponse.success(this.syncJobOrchestrator.getActivityLog(limit));
    }

    @DeleteMapping
    public CloudSyncHttpResponse<Void> clearActivityLog() {
        this.syncJobOrchestrator.clearActivityLog();
        return CloudSyncHttpResponse.success();
    }
}
