package com.cloudsync.server.model.api.job;

import lombok.Data;

// null 字段表示不修改
@Data
public class UpdateJobRequest {

    private String name;

    private String source;

    private String destination;

    private Integer intervalMinutes;

    private Integer concurrency;

    private Integer timeout;

    private Integer retries;
}
