package com.cloudsync.server.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ActivityTypeEnum {

    INFO("info"),

    WARNING("warning"),

    ERROR("error"),

    SUCCESS("success"),

    PROGRESS("progress"),

    ;

    @JsonValue
    private final String name;

    @JsonCreator
    public static ActivityTypeEnum fromName(String name) {
        for (ActivityTypeEnum value : values()) {
            if (value.getName().equalsIgnoreCase(name)) {
                return value;
            }
        }
        return INFO;
    }
}
