package com.cloudsync.server.model.api.systeminfo;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;

@Data
public class SystemInfo {

    @JsonSerialize(using = ToStringSerializer.class)
    private long uptime;

    private boolean online;

    private int jobCount;

    private int activeJobs;
}
