package com.example.feedreader.shared.job;

import com.example.feedreader.shared.broker.BrokerKeys;
import com.example.feedreader.shared.broker.NotificationBroker;
import com.example.feedreader.shared.config.AppProperties;
import com.example.feedreader.shared.dto.JobRecord;
import com.example.feedreader.shared.exception.NotificationFormatException;
import com.example.feedreader.shared.util.Constants.JobStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/**
 * Job status records kept in the broker with a rolling TTL.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobService {

    private final NotificationBroker broker;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public Mono<JobRecord> createJob(String userId, String type) {
        JobRecord job = JobRecord.builder()
                .jobId(UUID.randomUUID().toString())
                .userId(userId)
                .type(type)
                .status(JobStatus.PENDING)
                .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
        return write(job)
                .doOnError(e -> log.error("Failed to create {} job for user {}: {}", type, userId, e.getMessage()))
                .thenReturn(job);
    }

    /**
     * @return the job, or empty when it is missing, expired or unreadable
     */
    public Mono<JobRecord> getJob(String jobId) {
        return read(jobId)
                .onErrorResume(e -> {
                    log.warn("Failed to read job {}: {}", jobId, e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Marks a job with its new status. A job that no longer exists is not
     * recreated.
     */
    public Mono<Void> updateJob(String jobId, JobStatus status, Map<String, Object> result, String error) {
        return read(jobId)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Attempted to update non-existent job {}", jobId);
                    return Mono.empty();
                }))
                .flatMap(job -> write(job.toBuilder()
                        .status(status)
                        .result(result)
                        .error(error)
                        .completedAt(OffsetDateTime.now(ZoneOffset.UTC))
                        .build()))
                .onErrorResume(e -> {
                    log.error("Failed to update job {} to {}: {}", jobId, status, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<JobRecord> read(String jobId) {
        return broker.get(BrokerKeys.job(jobId))
                .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, JobRecord.class)));
    }

    private Mono<Void> write(JobRecord job) {
        return Mono.fromCallable(() -> serialize(job))
                .flatMap(json -> broker.set(BrokerKeys.job(job.getJobId()), json, appProperties.getJobs().getTtl()))
                .doOnNext(ok -> log.debug("Stored job {} with status {}", job.getJobId(), job.getStatus()))
                .then();
    }

    private String serialize(JobRecord job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new NotificationFormatException("Cannot serialize job " + job.getJobId(), e);
        }
    }
}
