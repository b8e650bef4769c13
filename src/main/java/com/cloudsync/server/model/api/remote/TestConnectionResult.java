package com.cloudsync.server.model.api.remote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TestConnectionResult {

    private boolean success;

    private String message;
}
