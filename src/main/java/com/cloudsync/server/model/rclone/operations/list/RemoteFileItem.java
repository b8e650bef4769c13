package com.cloudsync.server.model.rclone.operations.list;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

// rclone lsjson 的一项
@Data
public class RemoteFileItem {

    @JsonProperty("Path")
    private String path;

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Size")
    private long size;

    @JsonProperty("MimeType")
    private String mimeType;

    @JsonProperty("ModTime")
    private String modTime;

    @JsonProperty("IsDir")
    private boolean isDir;
}
