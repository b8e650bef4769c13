package com.cloudsync.server.service.rclone;

import com.cloudsync.server.exception.BusinessException;
import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.remote.TestConnectionResult;
import com.cloudsync.server.model.api.systeminfo.SystemSettings;
import com.cloudsync.server.model.entity.SyncJobEntity;
import com.cloudsync.server.model.rclone.global.RcloneExecResult;
import com.cloudsync.server.model.rclone.operations.about.AboutResponse;
import com.cloudsync.server.model.rclone.operations.list.RemoteFileItem;
import com.cloudsync.server.model.rclone.remote.RcloneRemote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class RcloneFacadeServiceTest {

    private SystemSettings systemSettings;

    private FakeRcloneRunner runner;

    private RcloneFacadeService rcloneFacadeService;

    @BeforeEach
    void setUp() {
        this.systemSettings = new SystemSettings();
        this.runner = new FakeRcloneRunner(this.systemSettings);
        this.rcloneFacadeService = new RcloneFacadeService(this.runner, this.systemSettings);
    }

    @Test
    void syncArgsCarryJobTuning() {
        SyncJobEntity job = SyncJobEntity.builder()
                .id("job1")
                .source("/data/photos")
                .destination("backup:photos")
                .concurrency(4)
                .timeout(60)
                .retries(3)
                .build();
        List<String> args = this.rcloneFacadeService.buildSyncArgs(job);
        assertEquals(List.of("sync", "/data/photos", "backup:photos"), args.subList(0, 3));
        assertEquals("4", valueOf(args, "--transfers"));
        // max(16, 2 * 4)
        assertEquals("16", valueOf(args, "--checkers"));
        assertEquals("3", valueOf(args, "--retries"));
        assertEquals("60s", valueOf(args, "--timeout"));
        assertEquals("1s", valueOf(args, "--stats"));
        assertEquals("info", valueOf(args, "--stats-log-level"));
        assertTrue(args.contains("--use-json-log"));
        assertTrue(args.contains("--fast-list"));
        assertTrue(args.contains("--ignore-errors"));
        assertTrue(args.contains("**/node_modules/**"));
        assertEquals("-v", args.get(args.size() - 1));
    }

    @Test
    void syncArgsDefaultMissingTuning() {
        SyncJobEntity job = SyncJobEntity.builder()
                .id("job1")
                .source("/a")
                .destination("/b")
                .concurrency(20)
                .build();
        List<String> args = this.rcloneFacadeService.buildSyncArgs(job);
        assertEquals("20", valueOf(args, "--transfers"));
        assertEquals("40", valueOf(args, "--checkers"));
        assertEquals(String.valueOf(SyncJobEntity.DEFAULT_RETRIES), valueOf(args, "--retries"));
        assertEquals(SyncJobEntity.DEFAULT_TIMEOUT_SEC + "s", valueOf(args, "--timeout"));
    }

    @Test
    void syncArgsRequireBothEnds() {
        SyncJobEntity job = SyncJobEntity.builder().id("job1").source("/a").build();
        assertThrows(ValidationException.class, () -> this.rcloneFacadeService.buildSyncArgs(job));
    }

    @Test
    void oneWayCheckAcceptsDifferences() {
        this.runner.respond("check", RcloneExecResult.success(1, "", ""));
        SyncJobEntity job = SyncJobEntity.builder().id("job1").source("/a").destination("remote:b").build();
        RcloneExecResult result = this.rcloneFacadeService.oneWayCheck(job).join();
        assertTrue(result.isSuccess());
        List<String> args = this.runner.getCalls().get(0);
        assertEquals(List.of("check", "/a", "remote:b", "--one-way", "--quiet"), args.subList(0, 5));
    }

    @Test
    void isConnectedProbesRemoteRoot() {
        this.runner.respond("lsd", args -> "gdrive:".equals(args.get(1)) ?
                RcloneExecResult.success(0, "", "") :
                RcloneExecResult.failed(3, "", "directory not found"));
        assertTrue(this.rcloneFacadeService.isConnected("gdrive").join());
        assertFalse(this.rcloneFacadeService.isConnected("s3").join());
        assertFalse(this.rcloneFacadeService.isConnected("").join());
        assertEquals(List.of("lsd", "gdrive:", "--max-depth", "0"), this.runner.getCalls().get(0));
    }

    @Test
    void parseRemotesLongAndShortFormat() {
        List<RcloneRemote> remotes = RcloneFacadeService.parseRemotes("backup:   drive\ns3:       s3\n\nold:\n");
        assertEquals(3, remotes.size());
        assertEquals(new RcloneRemote("backup", "drive"), remotes.get(0));
        assertEquals(new RcloneRemote("s3", "s3"), remotes.get(1));
        assertEquals(new RcloneRemote("old", "unknown"), remotes.get(2));
        assertTrue(RcloneFacadeService.parseRemotes("").isEmpty());
    }

    @Test
    void listRemotesFallsBackWithoutLongFlag() {
        this.runner.respond("listremotes", args -> args.contains("--long") ?
                RcloneExecResult.failed(1, "", "unknown flag: --long") :
                RcloneExecResult.success(0, "gdrive:\n", ""));
        List<RcloneRemote> remotes = this.rcloneFacadeService.listRemotes().join();
        assertEquals(List.of(new RcloneRemote("gdrive", "unknown")), remotes);
        assertEquals(2, this.runner.count("listremotes"));
    }

    @Test
    void listRemotesFailure() {
        this.runner.respond("listremotes", RcloneExecResult.failed(2, "", "config broken"));
        CompletionException e = assertThrows(
                CompletionException.class,
                () -> this.rcloneFacadeService.listRemotes().join());
        assertInstanceOf(BusinessException.class, e.getCause());
    }

    @Test
    void pickStorageRemotePrefersConfigured() {
        List<RcloneRemote> remotes = List.of(new RcloneRemote("s3", "s3"), new RcloneRemote("backup", "drive"));
        assertEquals("backup", this.rcloneFacadeService.pickStorageRemote(remotes));
        this.systemSettings.getStats().setStorageRemote("missing");
        assertEquals("s3", this.rcloneFacadeService.pickStorageRemote(remotes));
        assertNull(this.rcloneFacadeService.pickStorageRemote(List.of()));
    }

    @Test
    void aboutParsesJson() {
        this.runner.respond("about", RcloneExecResult.success(
                0, "{\"total\":1000,\"used\":250,\"free\":750,\"trashed\":0}", ""));
        AboutResponse aboutResponse = this.rcloneFacadeService.about("backup").join();
        assertEquals(Long.valueOf(1000), aboutResponse.getTotal());
        assertEquals(Long.valueOf(250), aboutResponse.getUsed());
        assertEquals(List.of("about", "backup:", "--json", "--timeout", "30s"), this.runner.getCalls().get(0));
    }

    @Test
    void testConnectionReportsFailureMessage() {
        this.runner.respond("lsd", RcloneExecResult.failed(1, "", "Failed to create file system: didn't find section"));
        TestConnectionResult result = this.rcloneFacadeService.testConnection("nope").join();
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("didn't find section"));

        this.runner.respond("lsd", RcloneExecResult.success(0, "", ""));
        result = this.rcloneFacadeService.testConnection("nope").join();
        assertTrue(result.isSuccess());
        assertEquals("Connection successful", result.getMessage());
    }

    @Test
    void listPathParsesLsjson() {
        this.runner.respond("lsjson", RcloneExecResult.success(0,
                "[{\"Path\":\"a.txt\",\"Name\":\"a.txt\",\"Size\":5,\"MimeType\":\"text/plain\"," +
                        "\"ModTime\":\"2024-01-01T00:00:00Z\",\"IsDir\":false}]", ""));
        List<RemoteFileItem> items = this.rcloneFacadeService.listPath("backup:docs").join();
        assertEquals(1, items.size());
        assertEquals("a.txt", items.get(0).getName());
        assertEquals(5L, items.get(0).getSize());
    }

    private static String valueOf(List<String> args, String flag) {
        int index = args.indexOf(flag);
        assertTrue(index >= 0, flag + " missing");
        return args.get(index + 1);
    }
}
