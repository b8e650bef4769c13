package com.cloudsync.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ConnectivityChangedEvent {

    private boolean online;
}
