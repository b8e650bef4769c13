package com.cloudsync.server.util;

import com.cloudsync.server.exception.ValidationException;
import com.cloudsync.server.model.api.job.CreateJobRequest;
import com.cloudsync.server.model.api.job.UpdateJobRequest;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

public class EntityValidationUtil {

    private static final int MAX_NAME_LENGTH = 100;

    // 一周
    private static final int MAX_INTERVAL_MINUTES = 10080;

    public static void isCreateJobRequestValid(CreateJobRequest createJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(createJobRequest)) {
            throw new ValidationException("isCreateJobRequestValid failed. createJobRequest is null");
        }
        // 检查 name, source 和 destination
        if (StringUtils.isAnyBlank(
                createJobRequest.getName(),
                createJobRequest.getSource(),
                createJobRequest.getDestination())) {
            throw new ValidationException("isCreateJobRequestValid failed. " +
                    "name: %s, source: %s or destination: %s is blank".formatted(
                            createJobRequest.getName(),
                            createJobRequest.getSource(),
                            createJobRequest.getDestination()));
        }
        checkTuning(
                createJobRequest.getName(),
                createJobRequest.getIntervalMinutes(),
                createJobRequest.getConcurrency(),
                createJobRequest.getTimeout(),
                createJobRequest.getRetries());
    }

    public static void isUpdateJobRequestValid(UpdateJobRequest updateJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(updateJobRequest)) {
            throw new ValidationException("isUpdateJobRequestValid failed. updateJobRequest is null");
        }
        if (ObjectUtils.allNull(
                updateJobRequest.getName(),
                updateJobRequest.getSource(),
                updateJobRequest.getDestination(),
                updateJobRequest.getIntervalMinutes(),
                updateJobRequest.getConcurrency(),
                updateJobRequest.getTimeout(),
                updateJobRequest.getRetries())) {
            throw new ValidationException("isUpdateJobRequestValid failed. at least one field is required");
        }
        if (updateJobRequest.getSource() != null && StringUtils.isBlank(updateJobRequest.getSource())) {
            throw new ValidationException("isUpdateJobRequestValid failed. source is blank");
        }
        if (updateJobRequest.getDestination() != null && StringUtils.isBlank(updateJobRequest.getDestination())) {
            throw new ValidationException("isUpdateJobRequestValid failed. destination is blank");
        }
        checkTuning(
                updateJobRequest.getName(),
                updateJobRequest.getIntervalMinutes(),
                updateJobRequest.getConcurrency(),
                updateJobRequest.getTimeout(),
                updateJobRequest.getRetries());
    }

    private static void checkTuning(
            String name,
            Integer intervalMinutes,
            Integer concurrency,
            Integer timeout,
            Integer retries) throws ValidationException {
        if (name != null && (StringUtils.isBlank(name) || name.length() > MAX_NAME_LENGTH)) {
            throw new ValidationException("job name must be 1..%d characters".formatted(MAX_NAME_LENGTH));
        }
        checkRange("intervalMinutes", intervalMinutes, 1, MAX_INTERVAL_MINUTES);
        checkRange("concurrency", concurrency, 1, 1000);
        checkRange("timeout", timeout, 10, 600);
        checkRange("retries", retries, 1, 100);
    }

    private static void checkRange(String field, Integer value, int min, int max) throws ValidationException {
        if (value == null) {
            return;
        }
        if (value < min || value > max) {
            throw new ValidationException("%s must be in [%d, %d], but is %d".formatted(field, min, max, value));
        }
    }
}
