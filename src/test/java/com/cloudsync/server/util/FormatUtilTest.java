package com.cloudsync.server.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormatUtilTest {

    @Test
    void formatDuration() {
        assertEquals("0s", FormatUtil.formatDuration(0));
        assertEquals("45s", FormatUtil.formatDuration(45));
        assertEquals("3m 20s", FormatUtil.formatDuration(200));
        assertEquals("2h 5m", FormatUtil.formatDuration(7500));
        assertEquals("0s", FormatUtil.formatDuration(-3));
    }

    @Test
    void formatBytes() {
        assertEquals("512 B", FormatUtil.formatBytes(512));
        assertEquals("1.5 KB", FormatUtil.formatBytes(1536));
        assertEquals("4.0 MB", FormatUtil.formatBytes(4L * 1024 * 1024));
        assertEquals("2.50 GB", FormatUtil.formatBytes(2560L * 1024 * 1024));
    }
}
