package com.cloudsync.server.configuration;

import com.cloudsync.server.exception.BusinessException;
import com.cloudsync.server.exception.CloudSyncException;
import com.cloudsync.server.exception.FileOperationException;
import com.cloudsync.server.exception.JsonException;
import com.cloudsync.server.exception.ResourceNotFoundException;
import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.global.CloudSyncHttpResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CompletionException;


@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("controller failed. business logic failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleResourceNotFoundException(ResourceNotFoundException e) {
        log.warn("controller failed. resource not found. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(FileOperationException.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleFileOperationException(FileOperationException e) {
        log.warn("controller failed. file operation failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(JsonException.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleJsonException(JsonException e) {
        log.warn("controller failed. json process failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleValidationException(ValidationException e) {
        log.warn("controller failed. validation failed. ", e);
        return toResponse(e);
    }

    // rclone 调用在 future 里失败
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleCompletionException(CompletionException e) {
        log.warn("controller failed. async rclone call failed. ", e);
        if (e.getCause() instanceof CloudSyncException) {
            return toResponse((CloudSyncException) e.getCause());
        }
        return toResponse(new CloudSyncException(HttpStatus.INTERNAL_SERVER_ERROR, e.toString()));
    }

    @ExceptionHandler(CloudSyncException.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleCloudSyncException(CloudSyncException e) {
        log.warn("controller failed. CloudSyncException happen", e);
        return toResponse(e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CloudSyncHttpResponse<Void>> handleGlobalException(Exception e) {
        log.warn("controller failed.", e);
        return toResponse(new CloudSyncException(HttpStatus.INTERNAL_SERVER_ERROR, e.toString()));
    }

    private static ResponseEntity<CloudSyncHttpResponse<Void>> toResponse(CloudSyncException e) {
        CloudSyncHttpResponse<Void> cloudSyncHttpResponse = CloudSyncHttpResponse.fail(e);
        return ResponseEntity.status(cloudSyncHttpResponse.getStatusCode()).body(cloudSyncHttpResponse);
    }
}
