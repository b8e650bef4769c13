package com.cloudsync.server.model.api.systeminfo;

import com.cloudsync.server.enums.TriggerPolicyEnum;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("cloudsync.server")
@Component
@Data
@NoArgsConstructor
public class SystemSettings {

    private DataFolder data = new DataFolder();

    private Rclone rclone = new Rclone();

    private Scheduler scheduler = new Scheduler();

    private Connectivity connectivity = new Connectivity();

    private ActivityLog activityLog = new ActivityLog();

    private Telemetry telemetry = new Telemetry();

    private Stats stats = new Stats();

    private Shutdown shutdown = new Shutdown();

    @Data
    public static class DataFolder {
        // jobs.json, activity.json, analytics.json 所在目录
        private String folderPath = "./data";
    }

    @Data
    public static class Rclone {
        private String binary = "rclone";

        // check, mkdir, about 等辅助命令的超时
        private int timeoutSec = 300;

        private int reachabilityTimeoutSec = 5;

        private String statsInterval = "1s";

        private List<String> excludes = new ArrayList<>(List.of(
                ".wrangler/**",
                "**/node_modules/**",
                "**/.git/**",
                "**/*.tmp"));
    }

    @Data
    public static class Scheduler {
        @JsonSerialize(using = ToStringSerializer.class)
        private Long intervalMillis = 60_000L;

        private TriggerPolicyEnum triggerPolicy = TriggerPolicyEnum.INTERVAL_ONLY;
    }

    @Data
    public static class Connectivity {
        private String probeHost = "google.com";

        @JsonSerialize(using = ToStringSerializer.class)
        private Long intervalMillis = 30_000L;
    }

    @Data
    public static class ActivityLog {
        private int maxEntries = 1000;

        private int defaultLimit = 100;
    }

    @Data
    public static class Telemetry {
        // 约 5 次/秒
        private long progressThrottleMillis = 200;

        private long minSampleIntervalMillis = 2000;

        // 125 MB/s, 超过视为测量误差
        private long maxSpeedBytes = 125L * 1024 * 1024;

        private long idleSpeedFloorBytes = 1024;
    }

    @Data
    public static class Stats {
        private String storageRemote = "backup";

        @JsonSerialize(using = ToStringSerializer.class)
        private Long refreshIntervalMillis = 300_000L;

        @JsonSerialize(using = ToStringSerializer.class)
        private Long pushIntervalMillis = 1000L;
    }

    @Data
    public static class Shutdown {
        private int graceSec = 10;
    }
}
