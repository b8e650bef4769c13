package com.cloudsync.server.model.api.remote;

import lombok.Data;

@Data
public class TestConnectionRequest {

    // remote name, with or without trailing ':'
    private String remote;
}
