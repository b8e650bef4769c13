package com.cloudsync.server.service.rclone;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.Set;
import java.util.function.Consumer;

@Data
@Builder
public class RunOptions {

    // 其余退出码视为失败
    @Builder.Default
    private Set<Integer> allowedExitCodes = Set.of(0);

    // null 表示不限时
    private Duration timeout;

    private Consumer<byte[]> onStdout;

    private Consumer<byte[]> onStderr;

    // registered handle the spawned process is attached to, may be null
    private SupervisedProcess supervisedProcess;

    // called once the process exists
    private Consumer<SupervisedProcess> onSpawn;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
