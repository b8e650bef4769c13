package com.cloudsync.server.service.rclone;

import com.cloudsync.server.MutableClock;
import com.cloudsync.server.SyncEngineTestUtil;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.rclone.core.stat.CoreStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RcloneTelemetryParserTest {

    private static final long MB = 1024 * 1024;

    private MutableClock clock;

    private RcloneTelemetryParser parser;

    private SyncJobEntity job;

    @BeforeEach
    void setUp() {
        this.clock = new MutableClock(SyncEngineTestUtil.START);
        this.parser = new RcloneTelemetryParser(new SystemSettings(), this.clock);
        this.job = SyncJobEntity.builder().id("job1").build();
    }

    @Test
    void firstSampleOnlySetsBaseline() {
        assertTrue(this.parser.acceptLine(this.job, SyncEngineTestUtil.statsLine(10 * MB, 100 * MB, 1, 10, "a.bin")));
        assertEquals(0, this.job.getSpeed());
        assertEquals(10, this.job.getProgress());
        assertEquals(10 * MB, this.job.getBytesTransferred());
        assertEquals(100 * MB, this.job.getTotalBytes());
        assertEquals(1, this.job.getFilesTransferred());
        assertEquals(10, this.job.getTotalFiles());
        assertEquals("a.bin", this.job.getCurrentFile());
        assertEquals(100 * MB, this.job.getCurrentFileSize());
        assertEquals("12s", this.job.getEta());
    }

    @Test
    void speedIsBlendedFromByteDelta() {
        this.parser.applyStats(this.job, stats(0, 100 * MB), 0);
        // 10 MB in 2s = 5 MB/s, 0.6 * 0 + 0.4 * 5 MB/s
        this.parser.applyStats(this.job, stats(10 * MB, 100 * MB), 2000);
        assertEquals(0.4 * 5 * MB, this.job.getSpeed(), 0.001);
        assertEquals(this.job.getSpeed(), this.job.getLastSpeed(), 0.001);
        // 另外 10 MB in 2s
        this.parser.applyStats(this.job, stats(20 * MB, 100 * MB), 4000);
        assertEquals(0.6 * 2 * MB + 0.4 * 5 * MB, this.job.getSpeed(), 0.001);
    }

    @Test
    void samplesCloserThanTwoSecondsKeepSpeed() {
        this.parser.applyStats(this.job, stats(0, 100 * MB), 0);
        this.parser.applyStats(this.job, stats(10 * MB, 100 * MB), 2000);
        double speed = this.job.getSpeed();
        this.parser.applyStats(this.job, stats(50 * MB, 100 * MB), 3000);
        assertEquals(speed, this.job.getSpeed(), 0.001);
        // 进度仍然更新
        assertEquals(50, this.job.getProgress());
        // 基准仍是 2000ms 的样本: 40 MB in 2s
        this.parser.applyStats(this.job, stats(50 * MB, 100 * MB), 4000);
        assertEquals(0.6 * speed + 0.4 * 20 * MB, this.job.getSpeed(), 0.001);
    }

    @Test
    void sampleIsCappedAtMaxSpeed() {
        this.parser.applyStats(this.job, stats(0, 10_000 * MB), 0);
        // 1000 MB/s 视为测量误差
        this.parser.applyStats(this.job, stats(2000 * MB, 10_000 * MB), 2000);
        assertEquals(0.4 * 125 * MB, this.job.getSpeed(), 0.001);
    }

    @Test
    void speedBelowFloorIsZero() {
        this.parser.applyStats(this.job, stats(0, 100 * MB), 0);
        // 1000 bytes in 2s
        this.parser.applyStats(this.job, stats(1000, 100 * MB), 2000);
        assertEquals(0, this.job.getSpeed());
        this.parser.applyStats(this.job, stats(1000, 100 * MB), 4000);
        assertEquals(0, this.job.getSpeed());
    }

    @Test
    void bytesGoingBackwardsCountAsNoProgress() {
        this.parser.applyStats(this.job, stats(10 * MB, 100 * MB), 0);
        this.parser.applyStats(this.job, stats(5 * MB, 100 * MB), 2000);
        assertEquals(0, this.job.getSpeed());
    }

    @Test
    void resetStartsNewBaseline() {
        this.parser.applyStats(this.job, stats(0, 100 * MB), 0);
        this.parser.applyStats(this.job, stats(10 * MB, 100 * MB), 2000);
        assertTrue(this.job.getSpeed() > 0);
        this.parser.reset("job1");
        this.parser.applyStats(this.job, stats(20 * MB, 100 * MB), 4000);
        assertEquals(0, this.job.getSpeed());
    }

    @Test
    void progressFallsBackToFileCount() {
        CoreStats stats = new CoreStats();
        stats.setTransfers(3);
        stats.setTotalTransfers(4);
        assertEquals(75, RcloneTelemetryParser.computeProgress(stats));
        assertEquals(0, RcloneTelemetryParser.computeProgress(new CoreStats()));
    }

    @Test
    void progressIsClampedToHundred() {
        assertEquals(100, RcloneTelemetryParser.computeProgress(stats(150, 100)));
    }

    @Test
    void nonJsonAndMalformedLinesAreIgnored() {
        assertFalse(this.parser.acceptLine(this.job, "2024/01/01 00:00:00 NOTICE: plain text"));
        assertFalse(this.parser.acceptLine(this.job, "{\"stats\": {\"bytes\": "));
        assertFalse(this.parser.acceptLine(this.job, "{\"level\":\"info\",\"msg\":\"Copied (new)\"}"));
        assertFalse(this.parser.acceptLine(this.job, "   "));
        assertEquals(0, this.job.getProgress());
        assertEquals(0, this.job.getBytesTransferred());
    }

    @Test
    void missingTransferringClearsCurrentFile() {
        this.parser.acceptLine(this.job, SyncEngineTestUtil.statsLine(MB, 2 * MB, 0, 1, "a.bin"));
        assertEquals("a.bin", this.job.getCurrentFile());
        this.parser.acceptLine(this.job, SyncEngineTestUtil.statsLine(2 * MB, 2 * MB, 1, 1, null));
        assertNull(this.job.getCurrentFile());
        assertNull(this.job.getCurrentFileSize());
        assertNull(this.job.getTransferring());
        assertEquals(100, this.job.getProgress());
    }

    private static CoreStats stats(long bytes, long totalBytes) {
        CoreStats stats = new CoreStats();
        stats.setBytes(bytes);
        stats.setTotalBytes(totalBytes);
        return stats;
    }
}
