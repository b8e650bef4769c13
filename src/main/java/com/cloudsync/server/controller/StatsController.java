package com.cloudsync.server.controller;

import com.cloudsync.server.model.api.global.CloudSyncHttpResponse;
import com.cloudsync.server.model.api.stats.SyncStats;
import com.cloudsync.server.service.facade.SyncJobOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/stats")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class StatsController {

    private final SyncJobOrchestrator syncJobOrchestrator;

    @Autowired
    public StatsController(SyncJobOrchestrator syncJobOrchestrator) {
        this.syncJobOrchestrator = syncJobOrchestrator;
    }

    @GetMapping
    public CloudSyncHttpResponse<SyncStats> getStats() {
        return CloudSyncHttpResponse.success(this.syncJobOrchestrator.getStats());
    }
}
