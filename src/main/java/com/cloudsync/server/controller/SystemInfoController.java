package com.cloudsync.server.controller;

import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.global.CloudSyncHttpResponse;
import com.cloudsync.server.model.api.systeminfo.SystemInfo;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.service.bussiness.ConnectivityMonitor;
import com.cloudsync.server.service.facade.SyncJobOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.lang.management.RuntimeMXBean;

@RestController
@RequestMapping("/api/v1/system-info")
@Slf4j
@CrossOrigin
public class SystemInfoController {

    private final SyncJobOrchestrator syncJobOrchestrator;

    private final ConnectivityMonitor connectivityMonitor;

    private final SystemSettings systemSettings;

    @Autowired
    public SystemInfoController(
            SyncJobOrchestrator syncJobOrchestrator,
            ConnectivityMonitor connectivityMonitor,
            SystemSettings systemSettings) {
        this.syncJobOrchestrator = syncJobOrchestrator;
        this.connectivityMonitor = connectivityMonitor;
        this.systemSettings = systemSettings;
    }

    @GetMapping("/get-system-settings")
    public CloudSyncHttpResponse<SystemSettings> getSystemSettings() {
        return CloudSyncHttpResponse.success(systemSettings);
    }

    @GetMapping("/get-system-info")
    public CloudSyncHttpResponse<SystemInfo> getSystemInfo() {
        SystemInfo systemInfo = new SystemInfo();
        // uptime
        RuntimeMXBean runtimeMXBean = ManagementFactory.getRuntimeMXBean();
        if (ObjectUtils.isEmpty(runtimeMXBean)) {
            throw new ValidationException("spring boot runtimeMXBean is null");
        }
        systemInfo.setUptime(runtimeMXBean.getUptime());
        systemInfo.setOnline(this.connectivityMonitor.isOnline());
        systemInfo.setJobCount(this.syncJobOrchestrator.getJobs().size());
        systemInfo.setActiveJobs(this.syncJobOrchestrator.getStats().getActiveJobs());
        return CloudSyncHttpResponse.success(systemInfo);
    }
}
