package com.cloudsync.server.model.rclone.global;

import com.cloudsync.server.enums.RcloneExitCodeEnum;
import com.cloudsync.server.exception.BusinessException;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

@Data
public class RcloneExecResult {

    // stdout/stderr 保留的最大长度
    public static final int MAX_OUTPUT_LENGTH = 100_000;

    private boolean success;

    private int exitCode = -1;

    private String stdout = "";

    private String stderr = "";

    // terminated on request, not a failure
    private boolean killed;

    private boolean timedOut;

    // fall back caught exception
    private BusinessException ex;

    private RcloneExecResult() {}

    // 成功响应工厂
    public static RcloneExecResult success(int exitCode, String stdout, String stderr) {
        RcloneExecResult result = new RcloneExecResult();
        result.setSuccess(true);
        result.setExitCode(exitCode);
        result.setStdout(stdout);
        result.setStderr(stderr);
        return result;
    }

    // 退出码不在允许范围内
    public static RcloneExecResult failed(int exitCode, String stdout, String stderr) {
        RcloneExecResult result = new RcloneExecResult();
        result.setSuccess(false);
        result.setExitCode(exitCode);
        result.setStdout(stdout);
        result.setStderr(stderr);
        return result;
    }

    public static RcloneExecResult killed(String stdout, String stderr) {
        RcloneExecResult result = new RcloneExecResult();
        result.setSuccess(false);
        result.setKilled(true);
        result.setStdout(stdout);
        result.setStderr(stderr);
        return result;
    }

    public static RcloneExecResult timedOut(String stdout, String stderr) {
        RcloneExecResult result = new RcloneExecResult();
        result.setSuccess(false);
        result.setTimedOut(true);
        result.setStdout(stdout);
        result.setStderr(stderr);
        return result;
    }

    // Exception 响应工厂, 进程没有启动或者 IO 失败
    public static RcloneExecResult failed(Throwable ex) {
        RcloneExecResult result = new RcloneExecResult();
        result.setSuccess(false);
        result.setEx(new BusinessException("rclone failed with unexpected exception.", ex));
        return result;
    }

    public RcloneExitCodeEnum getExitCodeEnum() {
        return RcloneExitCodeEnum.fromCode(this.exitCode);
    }

    public BusinessException getBusinessException() {
        if (this.success) return null;
        if (this.timedOut) {
            return new BusinessException("rclone: timeout");
        }
        if (this.killed) {
            return new BusinessException("rclone: terminated");
        }
        if (ObjectUtils.isNotEmpty(this.ex)) {
            return this.ex;
        }
        return new BusinessException("rclone exited with code %d: %s".formatted(
                this.exitCode, this.getErrorSummary()));
    }

    // 最后一行非空 stderr, 否则 stdout, 否则退出码说明
    public String getErrorSummary() {
        if (ObjectUtils.isNotEmpty(this.ex)) {
            Throwable root = this.ex.getCause() == null ? this.ex : this.ex.getCause();
            return StringUtils.defaultIfBlank(root.getMessage(), root.toString());
        }
        String lastLine = lastNonBlankLine(this.stderr);
        if (StringUtils.isBlank(lastLine)) {
            lastLine = lastNonBlankLine(this.stdout);
        }
        if (StringUtils.isBlank(lastLine)) {
            return this.getExitCodeEnum().getMessage();
        }
        return StringUtils.abbreviate(lastLine, 500);
    }

    private static String lastNonBlankLine(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        String[] lines = text.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (StringUtils.isNotBlank(lines[i])) {
                return lines[i].trim();
            }
        }
        return null;
    }
}
