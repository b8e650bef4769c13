package com.cloudsync.server.service.rclone;

import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.rclone.global.RcloneExecResult;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

// 用 sh 代替 rclone, 验证进程管理本身
@Slf4j
@EnabledOnOs({OS.LINUX, OS.MAC})
class RcloneRunnerTest {

    private SystemSettings systemSettings;

    private RcloneRunner rcloneRunner;

    @BeforeEach
    void setUp() {
        this.systemSettings = new SystemSettings();
        this.systemSettings.getRclone().setBinary("sh");
        this.rcloneRunner = new RcloneRunner(this.systemSettings);
    }

    @Test
    void exitCodeOutsideAllowedSetIsFailure() throws Exception {
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("-c", "echo hello; echo oops >&2; exit 3"), RunOptions.defaults())
                .get(10, TimeUnit.SECONDS);
        assertFalse(result.isSuccess());
        assertEquals(3, result.getExitCode());
        assertEquals("hello", result.getStdout());
        assertEquals("oops", result.getStderr());
        assertEquals("rclone exited with code 3: oops", result.getBusinessException().getMessage());
    }

    @Test
    void allowedExitCodeIsSuccess() throws Exception {
        RunOptions runOptions = RunOptions.builder().allowedExitCodes(Set.of(0, 1)).build();
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("-c", "exit 1"), runOptions)
                .get(10, TimeUnit.SECONDS);
        assertTrue(result.isSuccess());
        assertEquals(1, result.getExitCode());
    }

    @Test
    void argumentsAreNotSplitByShell() throws Exception {
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("-c", "echo \"$0\"", "a b; c"), RunOptions.defaults())
                .get(10, TimeUnit.SECONDS);
        assertTrue(result.isSuccess());
        assertEquals("a b; c", result.getStdout());
    }

    @Test
    void outputChunksAreForwarded() throws Exception {
        ByteArrayOutputStream forwarded = new ByteArrayOutputStream();
        RunOptions runOptions = RunOptions.builder()
                .onStderr(chunk -> forwarded.write(chunk, 0, chunk.length))
                .build();
        this.rcloneRunner
                .run(List.of("-c", "echo line1 >&2; echo line2 >&2"), runOptions)
                .get(10, TimeUnit.SECONDS);
        assertEquals("line1\nline2\n", forwarded.toString());
    }

    @Test
    void timeoutKillsProcess() throws Exception {
        RunOptions runOptions = RunOptions.builder().timeout(Duration.ofMillis(300)).build();
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("-c", "sleep 10"), runOptions)
                .get(10, TimeUnit.SECONDS);
        assertTrue(result.isTimedOut());
        assertFalse(result.isSuccess());
        assertEquals("rclone: timeout", result.getBusinessException().getMessage());
    }

    @Test
    void terminateIsReportedAsKilled() throws Exception {
        SupervisedProcess supervisedProcess = new SupervisedProcess("job1");
        RunOptions runOptions = RunOptions.builder()
                .supervisedProcess(supervisedProcess)
                .onSpawn(SupervisedProcess::terminate)
                .build();
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("-c", "sleep 10"), runOptions)
                .get(10, TimeUnit.SECONDS);
        assertTrue(supervisedProcess.isSpawned());
        assertTrue(result.isKilled());
        assertFalse(result.isSuccess());
    }

    @Test
    void spawnedProcessIsAttachedBeforeOnSpawn() throws Exception {
        SupervisedProcess supervisedProcess = new SupervisedProcess("job1");
        List<SupervisedProcess> spawned = new CopyOnWriteArrayList<>();
        RunOptions runOptions = RunOptions.builder()
                .supervisedProcess(supervisedProcess)
                .onSpawn(handle -> {
                    assertTrue(handle.isSpawned());
                    spawned.add(handle);
                })
                .build();
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("-c", "exit 0"), runOptions)
                .get(10, TimeUnit.SECONDS);
        assertTrue(result.isSuccess());
        assertEquals(List.of(supervisedProcess), spawned);
    }

    @Test
    void stopRequestedBeforeSpawnKillsOnAttach() throws Exception {
        SupervisedProcess supervisedProcess = new SupervisedProcess("job1");
        supervisedProcess.terminate();
        RunOptions runOptions = RunOptions.builder().supervisedProcess(supervisedProcess).build();
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("-c", "sleep 10"), runOptions)
                .get(10, TimeUnit.SECONDS);
        assertTrue(result.isKilled());
    }

    @Test
    void missingBinaryIsFailureNotException() throws Exception {
        this.systemSettings.getRclone().setBinary("/nonexistent/rclone-binary");
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("version"), RunOptions.defaults())
                .get(10, TimeUnit.SECONDS);
        assertFalse(result.isSuccess());
        assertNotNull(result.getBusinessException());
        log.info("missing binary reported as {}", result.getErrorSummary());
    }

    @Test
    void emptyArgsAreRejected() {
        assertThrows(ValidationException.class, () -> this.rcloneRunner.run(List.of(), RunOptions.defaults()));
    }
}
