package com.cloudsync.server.model.rclone.remote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RcloneRemote {

    private String name;

    // drive, s3, b2 ... or "unknown"
    private String type;
}
