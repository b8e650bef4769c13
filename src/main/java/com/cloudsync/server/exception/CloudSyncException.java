package com.cloudsync.server.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@Data
@EqualsAndHashCode(callSuper = false)
public class CloudSyncException extends RuntimeException {

    private HttpStatus status;

    public CloudSyncException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public CloudSyncException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public CloudSyncException(String message) {
        super(message);
    }

    public CloudSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getCloudSyncMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // 递归构建完整的异常消息链
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        // <exception name> : <exception message> -> <next>
        sb.append("%s : %s -> ".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof CloudSyncException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getCloudSyncMessage();
    }
}
