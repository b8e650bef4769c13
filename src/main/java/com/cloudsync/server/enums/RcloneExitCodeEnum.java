package com.cloudsync.server.enums;

import lombok.Getter;

// https://rclone.org/docs/#exit-code
@Getter
public enum RcloneExitCodeEnum {

    SUCCESS(0, "Success"),

    USAGE_ERROR(1, "Syntax or usage error"),

    UNCATEGORISED_ERROR(2, "Error not otherwise categorised"),

    DIRECTORY_NOT_FOUND(3, "Directory not found"),

    FILE_NOT_FOUND(4, "File not found"),

    TEMPORARY_ERROR(5, "Temporary error, more retries might fix this issue"),

    LESS_SERIOUS_ERROR(6, "Less serious errors, like 461 errors from dropbox"),

    FATAL_ERROR(7, "Fatal error, one that more retries won't fix"),

    TRANSFER_EXCEEDED(8, "Transfer exceeded, limit set by --max-transfer reached"),

    NO_FILES_TRANSFERRED(9, "Operation successful, but no files transferred"),

    DURATION_EXCEEDED(10, "Duration exceeded, limit set by --max-duration reached"),

    UNKNOWN(-1, "Unknown exit code");

    private final int code;

    private final String message;

    RcloneExitCodeEnum(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public static RcloneExitCodeEnum fromCode(int code) {
        for (RcloneExitCodeEnum value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
