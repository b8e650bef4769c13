package com.cloudsync.server.model.rclone.log;

import com.cloudsync.server.model.rclone.core.stat.CoreStats;
import lombok.Data;

// one line of `--use-json-log` output
@Data
public class RcloneJsonLog {

    private String level;

    private String msg;

    private String source;

    private String time;

    // only present on stats lines
    private CoreStats stats;
}
