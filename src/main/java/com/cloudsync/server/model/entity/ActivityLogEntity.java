package com.cloudsync.server.model.entity;

import com.cloudsync.server.enums.ActivityTypeEnum;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActivityLogEntity {

    // <epoch millis>-<random>
    private String id;

    private Instant timestamp;

    private ActivityTypeEnum type;

    private String jobId;

    private String jobName;

    private String message;

    private ActivityDetails details;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ActivityDetails {

        private Integer progress;

        private Double speed;

        private Long bytesTransferred;

        private Long filesTransferred;

        private String eta;

        private String fileName;

        private Long fileSize;

        private Long totalBytes;
    }
}
