package com.cloudsync.server.model.internal;

import com.cloudsync.server.model.entity.ActivityLogEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ActivityLoggedEvent {

    private ActivityLogEntity entry;
}
