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
import com.cloudsync.server.util.JsonUtil;
import com.cloudsync.server.util.RemotePathUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * rclone 命令的组装与结果解析. 进程本身由 {@link RcloneRunner} 负责.
 */
@Service
@Slf4j
public class RcloneFacadeService {

    // rclone check: 0 = identical, 1 = differences found
    public static final Set<Integer> CHECK_EXIT_CODES = Set.of(0, 1);

    private static final int MIN_CHECKERS = 16;

    private final RcloneRunner rcloneRunner;

    private final SystemSettings systemSettings;

    @Autowired
    public RcloneFacadeService(RcloneRunner rcloneRunner, SystemSettings systemSettings) {
        this.rcloneRunner = rcloneRunner;
        this.systemSettings = systemSettings;
    }

    // 只记录日志, rclone 缺失不阻止服务启动
    public void init() {
        RcloneExecResult result = this.rcloneRunner
                .run(List.of("version"), this.auxiliaryOptions(Set.of(0)))
                .join();
        if (!result.isSuccess()) {
            log.error("rclone init failed. binary is {}",
                    this.systemSettings.getRclone().getBinary(),
                    result.getBusinessException());
            return;
        }
        String firstLine = StringUtils.substringBefore(result.getStdout(), "\n");
        log.info("rclone init success. {}", firstLine);
    }

    // lsd remote: --max-depth 0
    public CompletableFuture<Boolean> isConnected(String remoteName) {
        if (StringUtils.isBlank(remoteName)) {
            return CompletableFuture.completedFuture(false);
        }
        RunOptions runOptions = RunOptions.builder()
                .timeout(Duration.ofSeconds(this.systemSettings.getRclone().getReachabilityTimeoutSec()))
                .build();
        return this.rcloneRunner
                .run(List.of("lsd", RemotePathUtil.toRemoteRoot(remoteName), "--max-depth", "0"), runOptions)
                .thenApply(result -> {
                    if (!result.isSuccess()) {
                        log.debug("remote is not reachable. remote is {}. {}",
                                remoteName, result.getErrorSummary());
                    }
                    return result.isSuccess();
                });
    }

    public CompletableFuture<RcloneExecResult> mkdir(String destination) {
        if (StringUtils.isBlank(destination)) {
            throw new ValidationException("mkdir failed. destination is blank");
        }
        return this.rcloneRunner.run(List.of("mkdir", destination), this.auxiliaryOptions(Set.of(0)));
    }

    public CompletableFuture<RcloneExecResult> sync(
            SyncJobEntity job,
            SupervisedProcess supervisedProcess,
            Consumer<byte[]> onStdout,
            Consumer<byte[]> onStderr) {
        // 不设超时, 由 --timeout 和 --retries 约束
        RunOptions runOptions = RunOptions.builder()
                .supervisedProcess(supervisedProcess)
                .onStdout(onStdout)
                .onStderr(onStderr)
                .build();
        return this.rcloneRunner.run(this.buildSyncArgs(job), runOptions);
    }

    public List<String> buildSyncArgs(SyncJobEntity job) {
        if (ObjectUtils.isEmpty(job) || StringUtils.isAnyBlank(job.getSource(), job.getDestination())) {
            throw new ValidationException("buildSyncArgs failed. job, source or destination is null");
        }
        int transfers = ObjectUtils.defaultIfNull(job.getConcurrency(), SyncJobEntity.DEFAULT_CONCURRENCY);
        List<String> args = new ArrayList<>();
        args.add("sync");
        args.add(job.getSource());
        args.add(job.getDestination());
        for (String exclude : this.systemSettings.getRclone().getExcludes()) {
            args.add("--exclude");
            args.add(exclude);
        }
        // 每秒一条 json stats
        args.add("--stats");
        args.add(this.systemSettings.getRclone().getStatsInterval());
        args.add("--use-json-log");
        args.add("--stats-log-level");
        args.add("info");
        args.add("--fast-list");
        args.add("--transfers");
        args.add(String.valueOf(transfers));
        args.add("--checkers");
        args.add(String.valueOf(Math.max(MIN_CHECKERS, transfers * 2)));
        // 单个文件失败不终止整体
        args.add("--ignore-errors");
        args.add("--retries");
        args.add(String.valueOf(ObjectUtils.defaultIfNull(job.getRetries(), SyncJobEntity.DEFAULT_RETRIES)));
        args.add("--retries-sleep");
        args.add("250ms");
        args.add("--low-level-retries");
        args.add("10");
        args.add("--timeout");
        args.add(ObjectUtils.defaultIfNull(job.getTimeout(), SyncJobEntity.DEFAULT_TIMEOUT_SEC) + "s");
        args.add("--contimeout");
        args.add("10s");
        args.add("-v");
        return args;
    }

    // rclone check src dst --one-way --quiet
    public CompletableFuture<RcloneExecResult> oneWayCheck(SyncJobEntity job) {
        if (ObjectUtils.isEmpty(job) || StringUtils.isAnyBlank(job.getSource(), job.getDestination())) {
            throw new ValidationException("oneWayCheck failed. job, source or destination is null");
        }
        List<String> args = new ArrayList<>(List.of(
                "check",
                job.getSource(),
                job.getDestination(),
                "--one-way",
                "--quiet"));
        for (String exclude : this.systemSettings.getRclone().getExcludes()) {
            args.add("--exclude");
            args.add(exclude);
        }
        return this.rcloneRunner.run(args, this.auxiliaryOptions(CHECK_EXIT_CODES));
    }

    public CompletableFuture<List<RcloneRemote>> listRemotes() {
        return this.rcloneRunner
                .run(List.of("listremotes", "--long"), this.auxiliaryOptions(Set.of(0)))
                .thenCompose(result -> {
                    if (result.isSuccess()) {
                        return CompletableFuture.completedFuture(result);
                    }
                    // 老版本 rclone 不支持 --long
                    log.debug("listremotes --long failed, fall back. {}", result.getErrorSummary());
                    return this.rcloneRunner.run(List.of("listremotes"), this.auxiliaryOptions(Set.of(0)));
                })
                .thenApply(result -> {
                    if (!result.isSuccess()) {
                        throw new BusinessException("listRemotes failed.", result.getBusinessException());
                    }
                    return parseRemotes(result.getStdout());
                });
    }

    public CompletableFuture<AboutResponse> about(String remoteName) {
        if (StringUtils.isBlank(remoteName)) {
            throw new ValidationException("about failed. remoteName is blank");
        }
        return this.rcloneRunner
                .run(
                        List.of("about", RemotePathUtil.toRemoteRoot(remoteName), "--json", "--timeout", "30s"),
                        this.auxiliaryOptions(Set.of(0)))
                .thenApply(result -> {
                    if (!result.isSuccess()) {
                        throw new BusinessException("about failed. remote is %s".formatted(remoteName),
                                result.getBusinessException());
                    }
                    return JsonUtil.parseJsonDocument(result.getStdout(), AboutResponse.class);
                });
    }

    public CompletableFuture<TestConnectionResult> testConnection(String remoteName) {
        if (StringUtils.isBlank(remoteName)) {
            throw new ValidationException("testConnection failed. remoteName is blank");
        }
        RunOptions runOptions = RunOptions.builder()
                .timeout(Duration.ofSeconds(this.systemSettings.getRclone().getReachabilityTimeoutSec()))
                .build();
        return this.rcloneRunner
                .run(List.of("lsd", RemotePathUtil.toRemoteRoot(remoteName), "--max-depth", "0"), runOptions)
                .thenApply(result -> result.isSuccess() ?
                        new TestConnectionResult(true, "Connection successful") :
                        new TestConnectionResult(false, result.getBusinessException().getMessage()));
    }

    public CompletableFuture<List<RemoteFileItem>> listPath(String path) {
        if (StringUtils.isBlank(path)) {
            throw new ValidationException("listPath failed. path is blank");
        }
        return this.rcloneRunner
                .run(List.of("lsjson", path), this.auxiliaryOptions(Set.of(0)))
                .thenApply(result -> {
                    if (!result.isSuccess()) {
                        throw new BusinessException("listPath failed. path is %s".formatted(path),
                                result.getBusinessException());
                    }
                    if (StringUtils.isBlank(result.getStdout())) {
                        return List.<RemoteFileItem>of();
                    }
                    return JsonUtil.parseJsonDocument(result.getStdout(), new TypeReference<List<RemoteFileItem>>() {});
                });
    }

    // "name:   type" 或 "name:"
    static List<RcloneRemote> parseRemotes(String stdout) {
        List<RcloneRemote> result = new ArrayList<>();
        if (StringUtils.isBlank(stdout)) {
            return result;
        }
        for (String line : stdout.split("\\R")) {
            if (StringUtils.isBlank(line) || !line.contains(":")) {
                continue;
            }
            String name = StringUtils.substringBefore(line, ":").trim();
            String type = StringUtils.trimToEmpty(StringUtils.substringAfter(line, ":"));
            if (StringUtils.isBlank(name)) {
                continue;
            }
            result.add(new RcloneRemote(name, StringUtils.defaultIfBlank(type, "unknown")));
        }
        return result;
    }

    // 选择 storage remote, 没有配置则取第一个
    public String pickStorageRemote(List<RcloneRemote> remotes) {
        if (CollectionUtils.isEmpty(remotes)) {
            return null;
        }
        String preferred = this.systemSettings.getStats().getStorageRemote();
        for (RcloneRemote remote : remotes) {
            if (remote.getName().equals(preferred)) {
                return remote.getName();
            }
        }
        return remotes.get(0).getName();
    }

    private RunOptions auxiliaryOptions(Set<Integer> allowedExitCodes) {
        return RunOptions.builder()
                .allowedExitCodes(allowedExitCodes)
                .timeout(Duration.ofSeconds(this.systemSettings.getRclone().getTimeoutSec()))
                .build();
    }
}
