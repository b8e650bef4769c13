package com.cloudsync.server.service.bussiness;

import com.cloudsync.server.SyncEngineTestUtil;
import com.cloudsync.server.enums.DiffStatusEnum;
import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.enums.TriggerPolicyEnum;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.internal.ConnectivityChangedEvent;
import com.cloudsync.server.model.rclone.global.RcloneExecResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerTest {

    private static final String RECURRING_MESSAGE = "Recurring sync cycle reached. Verifying integrity...";

    @TempDir
    Path dataFolder;

    private SyncEngineTestUtil engine;

    private TestConnectivityMonitor connectivityMonitor;

    private JobScheduler jobScheduler;

    @BeforeEach
    void setUp() {
        this.engine = new SyncEngineTestUtil(this.dataFolder);
        this.connectivityMonitor = new TestConnectivityMonitor(this.engine);
        this.jobScheduler = new JobScheduler(
                this.engine.orchestrator,
                this.engine.store,
                this.engine.registry,
                this.engine.activity,
                this.connectivityMonitor,
                this.engine.settings,
                this.engine.clock);
    }

    @Test
    void dueTimeFollowsLastRun() {
        Instant lastRun = Instant.parse("2024-01-01T10:00:00Z");
        SyncJobEntity neverRan = SyncJobEntity.builder()
                .intervalMinutes(10)
                .nextRun(lastRun)
                .status(JobStatusEnum.IDLE)
                .build();
        assertEquals(lastRun, JobScheduler.computeDueTime(neverRan));

        SyncJobEntity ran = neverRan.toBuilder().lastRun(lastRun).status(JobStatusEnum.SUCCESS).build();
        assertEquals(lastRun.plus(Duration.ofMinutes(10)), JobScheduler.computeDueTime(ran));

        // 失败后按 nextRun 重试
        SyncJobEntity failed = ran.toBuilder()
                .status(JobStatusEnum.ERROR)
                .nextRun(lastRun.plus(Duration.ofMinutes(25)))
                .build();
        assertEquals(lastRun.plus(Duration.ofMinutes(25)), JobScheduler.computeDueTime(failed));

        assertNull(JobScheduler.computeDueTime(SyncJobEntity.builder().build()));
    }

    @Test
    void dueJobIsTriggered() {
        this.addJob("job1");
        this.jobScheduler.tick();
        assertEquals(0, this.engine.runner.count("sync"));

        this.engine.clock.advance(Duration.ofMinutes(5));
        this.jobScheduler.tick();
        assertEquals(1, this.engine.runner.count("sync"));
        assertTrue(this.engine.activityMessages().contains(RECURRING_MESSAGE));
    }

    @Test
    void runningJobIsNotTriggeredAgain() {
        this.addJob("job1");
        this.engine.orchestrator.runNow("job1");
        this.engine.clock.advance(Duration.ofHours(1));
        this.jobScheduler.tick();
        assertEquals(1, this.engine.runner.count("sync"));
        assertFalse(this.engine.activityMessages().contains(RECURRING_MESSAGE));
    }

    @Test
    void jobBeingCheckedIsSkipped() {
        this.addJob("job1");
        this.engine.store.get("job1").setDiffStatus(DiffStatusEnum.CHECKING);
        this.engine.clock.advance(Duration.ofHours(1));
        this.jobScheduler.tick();
        assertEquals(0, this.engine.runner.count("sync"));
    }

    @Test
    void offlineTickDoesNothing() {
        this.addJob("job1");
        this.connectivityMonitor.reachable = false;
        this.connectivityMonitor.checkConnectivity();
        assertFalse(this.connectivityMonitor.isOnline());

        this.engine.clock.advance(Duration.ofHours(1));
        this.jobScheduler.tick();
        assertTrue(this.engine.runner.getCalls().isEmpty());
    }

    @Test
    void failedJobWaitsOneIntervalBeforeRetry() {
        this.engine.runner.respond("lsd", RcloneExecResult.failed(1, "", "offline"));
        this.addJob("job1");
        this.engine.orchestrator.runNow("job1");
        assertEquals(JobStatusEnum.ERROR, this.engine.store.get("job1").getStatus());
        assertEquals(1, this.engine.runner.count("lsd"));

        this.engine.clock.advance(Duration.ofMinutes(4));
        this.jobScheduler.tick();
        assertEquals(1, this.engine.runner.count("lsd"));

        this.engine.clock.advance(Duration.ofMinutes(1));
        this.jobScheduler.tick();
        assertEquals(2, this.engine.runner.count("lsd"));
    }

    @Test
    void differenceTriggersEarlySyncWhenEnabled() {
        this.engine.settings.getScheduler().setTriggerPolicy(TriggerPolicyEnum.INTERVAL_OR_DIFF);
        this.engine.runner.respond("check", RcloneExecResult.success(1, "", ""));
        this.addJob("job1");
        this.jobScheduler.tick();
        assertEquals(1, this.engine.runner.count("check"));
        assertEquals(1, this.engine.runner.count("sync"));
        assertTrue(this.engine.activityMessages().contains("Differences detected. Starting sync ahead of schedule."));
    }

    @Test
    void noDifferenceNoSync() {
        this.engine.settings.getScheduler().setTriggerPolicy(TriggerPolicyEnum.INTERVAL_OR_DIFF);
        this.engine.runner.respond("check", RcloneExecResult.success(0, "", ""));
        this.addJob("job1");
        this.jobScheduler.tick();
        assertEquals(1, this.engine.runner.count("check"));
        assertEquals(0, this.engine.runner.count("sync"));
    }

    @Test
    void intervalOnlyNeverChecks() {
        this.addJob("job1");
        this.jobScheduler.tick();
        assertEquals(0, this.engine.runner.count("check"));
    }

    @Test
    void connectivityLossIsLogged() {
        this.jobScheduler.onConnectivityChanged(new ConnectivityChangedEvent(false));
        assertTrue(this.engine.activityMessages().contains("Network connectivity lost. Scheduled syncs paused."));
        assertTrue(this.engine.runner.getCalls().isEmpty());
    }

    @Test
    void reconnectRearmsFailedJobsAndSyncsEverything() {
        this.engine.runner.respond("lsd", RcloneExecResult.failed(1, "", "offline"));
        this.addJob("job1");
        this.addJob("job2");
        this.engine.orchestrator.runNow("job1");
        assertEquals(JobStatusEnum.ERROR, this.engine.store.get("job1").getStatus());

        this.engine.runner.respond("lsd", RcloneExecResult.success(0, "", ""));
        this.jobScheduler.onConnectivityChanged(new ConnectivityChangedEvent(true));
        assertTrue(this.engine.activityMessages().contains("Network connectivity restored. Resuming scheduled syncs."));
        assertEquals(JobStatusEnum.RUNNING, this.engine.store.get("job1").getStatus());
        assertEquals(JobStatusEnum.RUNNING, this.engine.store.get("job2").getStatus());
        assertEquals(2, this.engine.runner.count("sync"));
    }

    private void addJob(String id) {
        this.engine.orchestrator.addJob(
                SyncEngineTestUtil.createJobRequest(id, this.dataFolder.toString(), "remote1:backup"));
    }

    private static class TestConnectivityMonitor extends ConnectivityMonitor {

        private volatile boolean reachable = true;

        TestConnectivityMonitor(SyncEngineTestUtil engine) {
            super(engine.settings, engine.publisher);
        }

        @Override
        protected boolean probe() {
            return this.reachable;
        }
    }
}
