package com.cloudsync.server.model.api.stats;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageStats {

    private long total;

    private long used;

    private long free;

    // 0 - 100
    private int percent;
}
