package com.cloudsync.server.service.db;

import com.cloudsync.server.MutableClock;
import com.cloudsync.server.SyncEngineTestUtil;
import com.cloudsync.server.enums.ActivityTypeEnum;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.ActivityLogEntity;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.internal.ActivityClearedEvent;
import com.cloudsync.server.model.internal.ActivityLoggedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ActivityLogServiceTest {

    @TempDir
    Path dataFolder;

    private final List<Object> events = new CopyOnWriteArrayList<>();

    private SystemSettings systemSettings;

    private MutableClock clock;

    private ActivityLogService activityLogService;

    @BeforeEach
    void setUp() {
        this.systemSettings = new SystemSettings();
        this.systemSettings.getData().setFolderPath(this.dataFolder.toString());
        this.clock = new MutableClock(SyncEngineTestUtil.START);
        this.activityLogService = new ActivityLogService(this.systemSettings, this.events::add, this.clock);
        this.activityLogService.init();
    }

    @Test
    void entriesAreReturnedNewestFirst() {
        SyncJobEntity job = SyncJobEntity.builder().id("job1").name("Photos").build();
        this.activityLogService.info(job, "first");
        this.clock.advanceMillis(10);
        this.activityLogService.warning(null, "second");
        this.clock.advanceMillis(10);
        this.activityLogService.error(job, "third");

        List<ActivityLogEntity> entries = this.activityLogService.getActivityLog(null);
        assertEquals(List.of("third", "second", "first"),
                entries.stream().map(ActivityLogEntity::getMessage).collect(Collectors.toList()));
        assertEquals(ActivityTypeEnum.ERROR, entries.get(0).getType());
        assertEquals("job1", entries.get(0).getJobId());
        assertEquals("Photos", entries.get(0).getJobName());
        assertNull(entries.get(1).getJobId());
        assertTrue(entries.get(2).getId().startsWith(SyncEngineTestUtil.START.toEpochMilli() + "-"));
        assertEquals(SyncEngineTestUtil.START, entries.get(2).getTimestamp());
    }

    @Test
    void limitIsApplied() {
        for (int i = 0; i < 5; i++) {
            this.activityLogService.info(null, "entry " + i);
        }
        List<ActivityLogEntity> entries = this.activityLogService.getActivityLog(2);
        assertEquals(2, entries.size());
        assertEquals("entry 4", entries.get(0).getMessage());

        this.systemSettings.getActivityLog().setDefaultLimit(3);
        assertEquals(3, this.activityLogService.getActivityLog(0).size());
        assertEquals(3, this.activityLogService.getActivityLog(-1).size());
    }

    @Test
    void oldestEntriesAreEvicted() {
        this.systemSettings.getActivityLog().setMaxEntries(3);
        for (int i = 0; i < 5; i++) {
            this.activityLogService.info(null, "entry " + i);
        }
        assertEquals(3, this.activityLogService.size());
        List<ActivityLogEntity> entries = this.activityLogService.getActivityLog(10);
        assertEquals("entry 4", entries.get(0).getMessage());
        assertEquals("entry 2", entries.get(2).getMessage());
    }

    @Test
    void everyEntryIsPublished() {
        ActivityLogEntity entry = this.activityLogService.info(null, "hello");
        assertEquals(1, this.events.size());
        assertEquals(entry, ((ActivityLoggedEvent) this.events.get(0)).getEntry());
    }

    @Test
    void progressEntriesReachDiskWithNextEntry() {
        ActivityLogEntity.ActivityDetails details = ActivityLogEntity.ActivityDetails.builder()
                .progress(50)
                .fileName("a.bin")
                .build();
        this.activityLogService.log(ActivityTypeEnum.PROGRESS, null, "Syncing: a.bin", details);
        ActivityLogService reloaded = new ActivityLogService(this.systemSettings, this.events::add, this.clock);
        reloaded.init();
        assertEquals(0, reloaded.size());

        this.activityLogService.info(null, "done");
        reloaded.init();
        assertEquals(2, reloaded.size());
        ActivityLogEntity progress = reloaded.getActivityLog(10).get(1);
        assertEquals(ActivityTypeEnum.PROGRESS, progress.getType());
        assertEquals(Integer.valueOf(50), progress.getDetails().getProgress());
        assertEquals("a.bin", progress.getDetails().getFileName());
    }

    @Test
    void clearEmptiesMemoryAndDisk() {
        this.activityLogService.info(null, "one");
        this.activityLogService.clear();
        assertEquals(0, this.activityLogService.size());
        assertInstanceOf(ActivityClearedEvent.class, this.events.get(this.events.size() - 1));

        ActivityLogService reloaded = new ActivityLogService(this.systemSettings, this.events::add, this.clock);
        reloaded.init();
        assertEquals(0, reloaded.size());
    }
}
