package com.cloudsync.server.model.rclone.operations.about;

import lombok.Data;

// `rclone about remote: --json`
@Data
public class AboutResponse {

    private Long total;

    private Long used;

    private Long free;

    private Long trashed;

    private Long other;
}
