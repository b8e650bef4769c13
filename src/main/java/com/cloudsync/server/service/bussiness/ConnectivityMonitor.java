package com.cloudsync.server.service.bussiness;

import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.internal.ConnectivityChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Online/offline flag from resolving a well known host. Only transitions are published, as
 * {@link ConnectivityChangedEvent}.
 */
@Service
@Slf4j
public class ConnectivityMonitor {

    private final SystemSettings systemSettings;

    private final ApplicationEventPublisher applicationEventPublisher;

    private volatile boolean online = true;

    @Autowired
    public ConnectivityMonitor(SystemSettings systemSettings, ApplicationEventPublisher applicationEventPublisher) {
        this.systemSettings = systemSettings;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // 启动时由 ApplicationLifeCycleConfig 先检查一次
    @Scheduled(
            initialDelayString = "${cloudsync.server.connectivity.interval-millis:30000}",
            fixedDelayString = "${cloudsync.server.connectivity.interval-millis:30000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void checkConnectivity() {
        boolean reachable;
        try {
            reachable = this.probe();
        } catch (RuntimeException e) {
            log.warn("connectivity probe failed.", e);
            reachable = false;
        }
        this.updateState(reachable);
    }

    public boolean isOnline() {
        return this.online;
    }

    protected boolean probe() {
        String probeHost = this.systemSettings.getConnectivity().getProbeHost();
        try {
            InetAddress.getAllByName(probeHost);
            return true;
        } catch (UnknownHostException e) {
            log.debug("connectivity probe failed. host is {}", probeHost);
            return false;
        }
    }

    private void updateState(boolean reachable) {
        synchronized (this) {
            if (reachable == this.online) {
                return;
            }
            this.online = reachable;
        }
        if (reachable) {
            log.info("network connectivity restored");
        } else {
            log.warn("network connectivity lost. scheduler paused");
        }
        this.applicationEventPublisher.publishEvent(new ConnectivityChangedEvent(reachable));
    }
}
