package com.example.feedreader.shared.dto;

import com.example.feedreader.shared.util.Constants.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Status record of a background job, stored as JSON under {@code job:{jobId}}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class JobRecord {
    private String jobId;
    private String userId;
    private String type;
    private JobStatus status;
    private Map<String, Object> result;
    private String error;
    private OffsetDateTime createdAt;
    private OffsetDateTime completedAt;
}
