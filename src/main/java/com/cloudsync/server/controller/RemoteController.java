package com.cloudsync.server.controller;

import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.global.CloudSyncHttpResponse;
import com.cloudsync.server.model.api.remote.TestConnectionRequest;
import com.cloudsync.server.model.api.remote.TestConnectionResult;
import com.cloudsync.server.model.rclone.operations.list.RemoteFileItem;
import com.cloudsync.server.model.rclone.remote.RcloneRemote;
import com.cloudsync.server.service.rclone.RcloneFacadeService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/remotes")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class RemoteController {

    private final RcloneFacadeService rcloneFacadeService;

    @Autowired
    public RemoteController(RcloneFacadeService rcloneFacadeService) {
        this.rcloneFacadeService = rcloneFacadeService;
    }

    @GetMapping
    public CompletableFuture<CloudSyncHttpResponse<List<RcloneRemote>>> listRemotes() {
        return this.rcloneFacadeService.listRemotes().thenApply(CloudSyncHttpResponse::success);
    }

    @PostMapping("/test")
    public CompletableFuture<CloudSyncHttpResponse<TestConnectionResult>> testConnection(
            @RequestBody TestConnectionRequest testConnectionRequest) {
        if (ObjectUtils.isEmpty(testConnectionRequest) || StringUtils.isBlank(testConnectionRequest.getRemote())) {
            throw new ValidationException("testConnection failed. remote is blank");
        }
        return this.rcloneFacadeService
                .testConnection(testConnectionRequest.getRemote())
                .thenApply(CloudSyncHttpResponse::success);
    }

    // path 形如 remote:folder 或本地路径
    @GetMapping("/browse")
    public CompletableFuture<CloudSyncHttpResponse<List<RemoteFileItem>>> browse(
            @RequestParam("path") String path) {
        return this.rcloneFacadeService.listPath(path).thenApply(CloudSyncHttpResponse::success);
    }
}
