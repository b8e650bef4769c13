package com.cloudsync.server.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.util.Map;
import java.util.Set;

@AllArgsConstructor
@Getter
public enum JobStatusEnum {

    IDLE("idle"),

    RUNNING("running"),

    ERROR("error"),

    SUCCESS("success"),

    ;

    @JsonValue
    private final String name;

    private static final Map<JobStatusEnum, Set<JobStatusEnum>> VALID_TRANSITIONS = Map.of(
            IDLE, Set.of(IDLE, RUNNING, ERROR),
            RUNNING, Set.of(RUNNING, SUCCESS, ERROR, IDLE),
            ERROR, Set.of(ERROR, IDLE, RUNNING),
            SUCCESS, Set.of(SUCCESS, IDLE, RUNNING, ERROR)
    );

    public static boolean isTransitionProhibit(JobStatusEnum from, JobStatusEnum to) {
        if (ObjectUtils.anyNull(from, to)) {
            return true;
        }
        Set<JobStatusEnum> validNextStatus = VALID_TRANSITIONS.get(from);
        if (CollectionUtils.isEmpty(validNextStatus)) {
            return true;
        }
        return !validNextStatus.contains(to);
    }

    @JsonCreator
    public static JobStatusEnum fromName(String name) {
        for (JobStatusEnum value : values()) {
            if (value.getName().equalsIgnoreCase(name)) {
                return value;
            }
        }
        // 未知状态按 idle 处理, 交给调度器重新判断
        return IDLE;
    }
}
