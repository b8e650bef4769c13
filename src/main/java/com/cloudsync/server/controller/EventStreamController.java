package com.cloudsync.server.controller;

import com.cloudsync.server.model.internal.ActivityClearedEvent;
import com.cloudsync.server.model.internal.ActivityLoggedEvent;
import com.cloudsync.server.model.internal.JobsUpdatedEvent;
import com.cloudsync.server.model.internal.StatsUpdatedEvent;
import com.cloudsync.server.service.facade.SyncJobOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Relays engine notifications to dashboard clients as server-sent events:
 * {@code jobs:update}, {@code activity:log}, {@code activity:cleared} and {@code stats:update}.
 */
@RestController
@RequestMapping("/api/v1/events")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class EventStreamController {

    private final SyncJobOrchestrator syncJobOrchestrator;

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    @Autowired
    public EventStreamController(SyncJobOrchestrator syncJobOrchestrator) {
        this.syncJobOrchestrator = syncJobOrchestrator;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe() {
        // 不超时, 客户端断开时移除
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> this.emitters.remove(emitter));
        emitter.onTimeout(() -> this.emitters.remove(emitter));
        emitter.onError(e -> this.emitters.remove(emitter));
        this.emitters.add(emitter);
        // 新连接先推一次全量
        this.send(emitter, "jobs:update", this.syncJobOrchestrator.getJobs());
        this.send(emitter, "stats:update", this.syncJobOrchestrator.getStats());
        return emitter;
    }

    @EventListener
    public void onJobsUpdated(JobsUpdatedEvent event) {
        this.broadcast("jobs:update", event.getJobs());
    }

    @EventListener
    public void onActivityLogged(ActivityLoggedEvent event) {
        this.broadcast("activity:log", event.getEntry());
    }

    @EventListener
    public void onActivityCleared(ActivityClearedEvent event) {
        this.broadcast("activity:cleared", event);
    }

    @EventListener
    public void onStatsUpdated(StatsUpdatedEvent event) {
        this.broadcast("stats:update", event.getStats());
    }

    @Scheduled(
            fixedDelayString = "${cloudsync.server.stats.push-interval-millis:1000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void pushStats() {
        if (this.emitters.isEmpty()) {
            return;
        }
        this.broadcast("stats:update", this.syncJobOrchestrator.getStats());
    }

    private void broadcast(String eventName, Object data) {
        for (SseEmitter emitter : this.emitters) {
            this.send(emitter, eventName, data);
        }
    }

    private void send(SseEmitter emitter, String eventName, Object data) {
        try {
            emitter.send(SseEmitter.event().name(eventName).data(data, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("sse send failed, client dropped. event is {}", eventName);
            this.emitters.remove(emitter);
        }
    }
}
