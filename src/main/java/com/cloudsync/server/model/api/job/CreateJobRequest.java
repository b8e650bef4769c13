package com.cloudsync.server.model.api.job;

import lombok.Data;

@Data
public class CreateJobRequest {

    // 可选, 为空则由服务端生成
    private String id;

    private String name;

    private String source;

    private String destination;

    private Integer intervalMinutes;

    private Integer concurrency;

    private Integer timeout;

    private Integer retries;
}
