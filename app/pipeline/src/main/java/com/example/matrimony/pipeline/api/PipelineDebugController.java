/*
 * Where: pipeline debug API
 * What: per-recipient queue view, per-job execution history and manual job runs
 * Why: operators inspect and nudge the pipeline without database access
 */
package com.example.matrimony.pipeline.api;

import com.example.matrimony.pipeline.job.JobNotFoundException;
import com.example.matrimony.pipeline.job.JobScheduler;
import com.example.matrimony.pipeline.model.JobExecutionRecord;
import com.example.matrimony.pipeline.model.NotificationRecord;
import com.example.matrimony.pipeline.repository.JobDefinitionRepository;
import com.example.matrimony.pipeline.repository.JobExecutionRepository;
import com.example.matrimony.pipeline.repository.NotificationQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug")
@RequiredArgsConstructor
public class PipelineDebugController {

    private static final int MAX_EXECUTIONS = 200;

    private final NotificationQueueRepository queueRepository;
    private final JobDefinitionRepository definitionRepository;
    private final JobExecutionRepository executionRepository;
    private final JobScheduler jobScheduler;
    private final ObjectMapper objectMapper;

    @GetMapping("/notifications/{recipient}")
    public NotificationInboxResponse notifications(@PathVariable("recipient") String recipient) {
        List<NotificationSummary> items = queueRepository.findByRecipient(recipient).stream()
                .map(this::toSummary)
                .toList();
        return new NotificationInboxResponse(recipient, items);
    }

    @GetMapping("/jobs/{name}/executions")
    public JobExecutionsResponse executions(
            @PathVariable("name") String name,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (definitionRepository.findByName(name).isEmpty()) {
            throw new JobNotFoundException(name);
        }
        int bounded = Math.max(1, Math.min(limit, MAX_EXECUTIONS));
        List<JobExecutionSummary> items = executionRepository.findByJobName(name, bounded).stream()
                .map(this::toSummary)
                .toList();
        return new JobExecutionsResponse(name, items);
    }

    @PostMapping("/jobs/{name}/run")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobRunResponse run(@PathVariable("name") String name) {
        UUID executionId = jobScheduler.runNow(name, JobExecutionRecord.TRIGGERED_BY_MANUAL);
        return new JobRunResponse(name, executionId);
    }

    private NotificationSummary toSummary(NotificationRecord record) {
        return new NotificationSummary(
                record.notificationId(),
                record.channel(),
                record.trigger(),
                record.status(),
                record.attempts(),
                record.maxAttempts(),
                record.lastError(),
                record.createdAt(),
                record.sentAt(),
                record.scheduledFor(),
                readJson(record.templateDataJson(), "notification template data"));
    }

    private JobExecutionSummary toSummary(JobExecutionRecord record) {
        return new JobExecutionSummary(
                record.executionId(),
                record.status(),
                record.triggeredBy(),
                record.executedBy(),
                record.startedAt(),
                record.finishedAt(),
                record.errorMessage(),
                readJson(record.resultJson(), "job result"));
    }

    private JsonNode readJson(String json, String what) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException(what + " parse failure", ex);
        }
    }
}
