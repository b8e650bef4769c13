package com.cloudsync.server.service.db;

import com.cloudsync.server.enums.JobStatusEnum;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.AnalyticsEntity;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.rclone.core.stat.TransferringJobStat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncJobStoreTest {

    @TempDir
    Path dataFolder;

    private SystemSettings systemSettings;

    @BeforeEach
    void setUp() {
        this.systemSettings = new SystemSettings();
        this.systemSettings.getData().setFolderPath(this.dataFolder.toString());
    }

    @Test
    void persistAndReload() {
        SyncJobStore store = new SyncJobStore(this.systemSettings);
        store.init();
        Instant lastRun = Instant.parse("2024-01-01T10:00:00Z");
        store.put(SyncJobEntity.builder()
                .id("b")
                .name("second")
                .source("/b")
                .destination("remote:b")
                .intervalMinutes(15)
                .status(JobStatusEnum.SUCCESS)
                .lastRun(lastRun)
                .build());
        store.put(SyncJobEntity.builder().id("a").name("first").source("/a").destination("/c")
                .status(JobStatusEnum.ERROR).lastError("boom").build());
        store.persist();

        SyncJobStore reloaded = new SyncJobStore(this.systemSettings);
        reloaded.init();
        List<SyncJobEntity> jobs = reloaded.getAll();
        assertEquals(2, jobs.size());
        // 插入顺序
        assertEquals("b", jobs.get(0).getId());
        assertEquals(lastRun, jobs.get(0).getLastRun());
        assertEquals(Integer.valueOf(15), jobs.get(0).getIntervalMinutes());
        assertEquals(JobStatusEnum.SUCCESS, jobs.get(0).getStatus());
        assertEquals(JobStatusEnum.ERROR, reloaded.get("a").getStatus());
        assertEquals("boom", reloaded.get("a").getLastError());
    }

    @Test
    void runningJobIsIdleAfterRestart() {
        SyncJobStore store = new SyncJobStore(this.systemSettings);
        store.put(SyncJobEntity.builder()
                .id("a")
                .source("/a")
                .destination("/b")
                .status(JobStatusEnum.RUNNING)
                .progress(42)
                .bytesTransferred(1000)
                .speed(500)
                .currentFile("x.bin")
                .transferring(List.of(new TransferringJobStat("x.bin", 10, 5, 50, 1, 1, null)))
                .build());
        store.persist();

        SyncJobStore reloaded = new SyncJobStore(this.systemSettings);
        reloaded.init();
        SyncJobEntity job = reloaded.get("a");
        assertEquals(JobStatusEnum.IDLE, job.getStatus());
        assertEquals(0, job.getProgress());
        assertEquals(0, job.getBytesTransferred());
        assertEquals(0, job.getSpeed());
        assertNull(job.getCurrentFile());
        assertNull(job.getTransferring());
    }

    @Test
    void analyticsAreNotWrittenToJobsFile() throws Exception {
        SyncJobStore store = new SyncJobStore(this.systemSettings);
        store.put(SyncJobEntity.builder()
                .id("a")
                .source("/a")
                .destination("/b")
                .analytics(new AnalyticsEntity(1, 2, 3, 4))
                .build());
        store.persist();
        String content = Files.readString(this.dataFolder.resolve("jobs.json"), StandardCharsets.UTF_8);
        assertFalse(content.contains("analytics"));
    }

    @Test
    void missingOrCorruptFileStartsEmpty() throws Exception {
        SyncJobStore store = new SyncJobStore(this.systemSettings);
        store.init();
        assertTrue(store.getAll().isEmpty());

        Files.writeString(this.dataFolder.resolve("jobs.json"), "[{not json", StandardCharsets.UTF_8);
        store.init();
        assertTrue(store.getAll().isEmpty());
    }

    @Test
    void persistFailureIsSwallowed() throws Exception {
        // 数据目录是一个文件, 写入必然失败
        Path notAFolder = Files.createFile(this.dataFolder.resolve("blocked"));
        this.systemSettings.getData().setFolderPath(notAFolder.toString());
        SyncJobStore store = new SyncJobStore(this.systemSettings);
        store.put(SyncJobEntity.builder().id("a").source("/a").destination("/b").build());
        assertDoesNotThrow(store::persist);
        assertNotNull(store.get("a"));
    }

    @Test
    void removeAndContains() {
        SyncJobStore store = new SyncJobStore(this.systemSettings);
        store.put(SyncJobEntity.builder().id("a").build());
        assertTrue(store.contains("a"));
        assertNotNull(store.remove("a"));
        assertFalse(store.contains("a"));
        assertNull(store.remove("a"));
        assertNull(store.get(null));
    }
}
