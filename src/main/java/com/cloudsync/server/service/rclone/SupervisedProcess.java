package com.cloudsync.server.service.rclone;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;

import java.util.concurrent.CompletableFuture;

/**
 * Handle of one rclone invocation made on behalf of a job.
 * <p>
 * The handle exists before the process does: it is claimed in the registry first and the
 * {@link Process} is attached once spawned. A stop requested before that point kills the
 * process as soon as it is attached.
 */
@Slf4j
public class SupervisedProcess {

    @Getter
    private final String jobId;

    private Process process;

    private volatile boolean stopRequested = false;

    // 进程结束且结果处理完成
    private final CompletableFuture<Void> settled = new CompletableFuture<>();

    public SupervisedProcess(String jobId) {
        this.jobId = jobId;
    }

    public synchronized void attach(Process process) {
        this.process = process;
        if (this.stopRequested && process.isAlive()) {
            log.info("process attached after stop request, terminating. jobId is {}", this.jobId);
            process.destroy();
        }
    }

    public synchronized boolean isSpawned() {
        return ObjectUtils.isNotEmpty(this.process);
    }

    // SIGTERM
    public synchronized void terminate() {
        this.stopRequested = true;
        if (ObjectUtils.isNotEmpty(this.process) && this.process.isAlive()) {
            this.process.destroy();
        }
    }

    // SIGKILL
    public synchronized void forceKill() {
        this.stopRequested = true;
        if (ObjectUtils.isNotEmpty(this.process) && this.process.isAlive()) {
            log.warn("force killing rclone. jobId is {}", this.jobId);
            this.process.destroyForcibly();
        }
    }

    public boolean isStopRequested() {
        return this.stopRequested;
    }

    public void markSettled() {
        this.settled.complete(null);
    }

    public CompletableFuture<Void> getSettled() {
        return this.settled;
    }
}
