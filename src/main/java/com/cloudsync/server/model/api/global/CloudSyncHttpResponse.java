package com.cloudsync.server.model.api.global;

import com.cloudsync.server.exception.CloudSyncException;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;


@Data
public class CloudSyncHttpResponse<T> {

    private int statusCode;

    private String message;

    private T data;

    @JsonSerialize(using = ToStringSerializer.class)
    private final long timestamp = System.currentTimeMillis();

    private CloudSyncHttpResponse() {}

    public static <T> CloudSyncHttpResponse<T> success(T data, String message) {
        CloudSyncHttpResponse<T> result = new CloudSyncHttpResponse<>();
        result.statusCode = HttpStatus.OK.value();
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> CloudSyncHttpResponse<T> success(T data) {
        return success(data, "success");
    }

    public static CloudSyncHttpResponse<Void> success() {
        return success(null);
    }

    public static CloudSyncHttpResponse<Void> fail(CloudSyncException e) {
        CloudSyncHttpResponse<Void> result = new CloudSyncHttpResponse<>();
        // fall back 方法
        result.statusCode = ObjectUtils.isEmpty(e.getStatus()) ?
                HttpStatus.INTERNAL_SERVER_ERROR.value() :
                e.getStatus().value();
        result.message = e.getCloudSyncMessage();
        return result;
    }
}
