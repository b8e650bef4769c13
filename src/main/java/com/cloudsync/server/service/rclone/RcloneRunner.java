package com.cloudsync.server.service.rclone;

import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.rclone.global.RcloneExecResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteResultHandler;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.ProcessDestroyer;
import org.apache.commons.exec.PumpStreamHandler;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Spawns rclone with an argument list and reports the outcome as a {@link RcloneExecResult}.
 * Never throws for process failures; only invalid arguments are rejected eagerly.
 */
@Service
@Slf4j
public class RcloneRunner {

    private final SystemSettings systemSettings;

    @Autowired
    public RcloneRunner(SystemSettings systemSettings) {
        this.systemSettings = systemSettings;
    }

    public CompletableFuture<RcloneExecResult> run(List<String> args, RunOptions runOptions)
            throws ValidationException {
        // 参数检查
        if (CollectionUtils.isEmpty(args)) {
            throw new ValidationException("rclone run failed. args is empty");
        }
        RunOptions options = ObjectUtils.isEmpty(runOptions) ? RunOptions.defaults() : runOptions;
        // 1. 命令行, 参数不经过 shell, 也不做引号处理
        CommandLine commandLine = new CommandLine(this.systemSettings.getRclone().getBinary());
        for (String arg : args) {
            commandLine.addArgument(arg, false);
        }
        SupervisedProcess supervisedProcess = ObjectUtils.isEmpty(options.getSupervisedProcess()) ?
                new SupervisedProcess(null) :
                options.getSupervisedProcess();
        // 2. 执行器, 退出码由这里判断
        DefaultExecutor executor = DefaultExecutor.builder().get();
        executor.setExitValues(null);
        // 3. 输出流
        CapturingOutputStream stdout = new CapturingOutputStream(options.getOnStdout());
        CapturingOutputStream stderr = new CapturingOutputStream(options.getOnStderr());
        executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));
        // 4. watchdog 负责超时, destroyer 负责拿到 Process
        Duration timeout = ObjectUtils.isEmpty(options.getTimeout()) ?
                ExecuteWatchdog.INFINITE_TIMEOUT_DURATION :
                options.getTimeout();
        ExecuteWatchdog watchdog = ExecuteWatchdog.builder().setTimeout(timeout).get();
        executor.setWatchdog(watchdog);
        executor.setProcessDestroyer(new SupervisingProcessDestroyer(supervisedProcess, options.getOnSpawn()));
        // 5. 非阻塞执行
        CompletableFuture<RcloneExecResult> future = new CompletableFuture<>();
        log.debug("rclone {}", String.join(" ", args));
        try {
            executor.execute(commandLine, new ExecuteResultHandler() {
                @Override
                public void onProcessComplete(int exitValue) {
                    future.complete(toResult(exitValue, null));
                }

                @Override
                public void onProcessFailed(ExecuteException e) {
                    future.complete(toResult(e.getExitValue(), e));
                }

                private RcloneExecResult toResult(int exitValue, ExecuteException e) {
                    String stdoutString = stdout.asString();
                    String stderrString = stderr.asString();
                    if (supervisedProcess.isStopRequested()) {
                        return RcloneExecResult.killed(stdoutString, stderrString);
                    }
                    if (watchdog.killedProcess()) {
                        return RcloneExecResult.timedOut(stdoutString, stderrString);
                    }
                    // 进程没有启动
                    if (ObjectUtils.isNotEmpty(e) && !supervisedProcess.isSpawned()) {
                        return RcloneExecResult.failed(e);
                    }
                    if (options.getAllowedExitCodes().contains(exitValue)) {
                        return RcloneExecResult.success(exitValue, stdoutString, stderrString);
                    }
                    return RcloneExecResult.failed(exitValue, stdoutString, stderrString);
                }
            });
        } catch (Exception e) {
            future.complete(RcloneExecResult.failed(e));
        }
        return future;
    }

    // 拿到 Process 的唯一入口, executor 在进程启动后调用 add
    private static class SupervisingProcessDestroyer implements ProcessDestroyer {

        private final SupervisedProcess supervisedProcess;

        private final Consumer<SupervisedProcess> onSpawn;

        private int size = 0;

        SupervisingProcessDestroyer(SupervisedProcess supervisedProcess, Consumer<SupervisedProcess> onSpawn) {
            this.supervisedProcess = supervisedProcess;
            this.onSpawn = onSpawn;
        }

        @Override
        public synchronized boolean add(Process process) {
            this.size++;
            this.supervisedProcess.attach(process);
            if (ObjectUtils.isEmpty(this.onSpawn)) {
                return true;
            }
            try {
                this.onSpawn.accept(this.supervisedProcess);
            } catch (RuntimeException e) {
                log.warn("onSpawn callback failed. jobId is {}", this.supervisedProcess.getJobId(), e);
            }
            return true;
        }

        @Override
        public synchronized boolean remove(Process process) {
            if (this.size == 0) {
                return false;
            }
            this.size--;
            return true;
        }

        @Override
        public synchronized int size() {
            return this.size;
        }
    }

    // 转发每个 chunk, 同时保留最后 MAX_OUTPUT_LENGTH 字节
    private static class CapturingOutputStream extends OutputStream {

        private final Consumer<byte[]> onChunk;

        private ByteArrayOutputStream captured = new ByteArrayOutputStream();

        CapturingOutputStream(Consumer<byte[]> onChunk) {
            this.onChunk = onChunk;
        }

        @Override
        public void write(int b) {
            this.write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) {
            this.captured.write(b, off, len);
            if (this.captured.size() > 2 * RcloneExecResult.MAX_OUTPUT_LENGTH) {
                byte[] all = this.captured.toByteArray();
                this.captured = new ByteArrayOutputStream();
                this.captured.write(
                        all,
                        all.length - RcloneExecResult.MAX_OUTPUT_LENGTH,
                        RcloneExecResult.MAX_OUTPUT_LENGTH);
            }
            if (ObjectUtils.isEmpty(this.onChunk)) {
                return;
            }
            try {
                this.onChunk.accept(Arrays.copyOfRange(b, off, off + len));
            } catch (RuntimeException e) {
                log.warn("output chunk handler failed.", e);
            }
        }

        synchronized String asString() {
            String result = this.captured.toString(StandardCharsets.UTF_8);
            if (result.length() > RcloneExecResult.MAX_OUTPUT_LENGTH) {
                result = result.substring(result.length() - RcloneExecResult.MAX_OUTPUT_LENGTH);
            }
            return result.trim();
        }
    }
}
