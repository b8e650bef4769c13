package com.cloudsync.server.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum DiffStatusEnum {

    SYNCED("synced"),

    DIFFERENT("different"),

    CHECKING("checking"),

    ERROR("error"),

    ;

    @JsonValue
    private final String name;

    @JsonCreator
    public static DiffStatusEnum fromName(String name) {
        for (DiffStatusEnum value : values()) {
            if (value.getName().equalsIgnoreCase(name)) {
                return value;
            }
        }
        return null;
    }
}
