package com.example.feedreader.notification.controller;

import com.example.feedreader.shared.dto.JobRecord;
import com.example.feedreader.shared.exception.JobNotFoundException;
import com.example.feedreader.shared.job.JobService;
import com.example.feedreader.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    /**
     * Jobs of other users are reported as missing.
     */
    @GetMapping("/{jobId}")
    public Mono<JobRecord> getJob(@PathVariable String jobId, ServerWebExchange exchange) {
        String userId = exchange.getAttribute(Constants.SESSION_USER_ATTRIBUTE);
        if (userId == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required"));
        }
        return jobService.getJob(jobId)
                .filter(job -> userId.equals(job.getUserId()))
                .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }
}
