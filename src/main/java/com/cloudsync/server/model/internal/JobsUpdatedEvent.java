package com.cloudsync.server.model.internal;

import com.cloudsync.server.model.entity.SyncJobEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class JobsUpdatedEvent {

    private List<SyncJobEntity> jobs;
}
