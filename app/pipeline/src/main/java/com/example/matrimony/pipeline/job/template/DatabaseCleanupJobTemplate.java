/*
 * Where: pipeline job templates
 * What: deletes (or counts, in dry-run) rows older than a per-target age, target by target
 * Why: one failing table must not stop the cleanup of the others
 */
package com.example.matrimony.pipeline.job.template;

import com.example.matrimony.pipeline.job.InvalidJobParametersException;
import com.example.matrimony.pipeline.job.JobContext;
import com.example.matrimony.pipeline.job.JobParameters;
import com.example.matrimony.pipeline.job.JobResult;
import com.example.matrimony.pipeline.job.JobTemplate;
import com.example.matrimony.pipeline.repository.CollectionCleanupRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DatabaseCleanupJobTemplate implements JobTemplate {

  public static final String TYPE = "database_cleanup";

  static final String TARGETS = "targets";
  static final String DRY_RUN = "dryRun";
  static final String DEFAULT_TIMESTAMP_FIELD = "created_at";
  static final int MAX_AGE_DAYS = 3650;

  private static final Logger logger = LoggerFactory.getLogger(DatabaseCleanupJobTemplate.class);

  private final CollectionCleanupRepository cleanupRepository;

  record CleanupTarget(String collection, int ageThresholdDays, String timestampField) {}

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public void validateParameters(JobParameters parameters) {
    parameters.getBoolean(DRY_RUN, false);
    final List<CleanupTarget> targets = parseTargets(parameters);
    if (targets.isEmpty()) {
      throw new InvalidJobParametersException(TARGETS + " must contain at least one target");
    }
    for (CleanupTarget target : targets) {
      if (!cleanupRepository.isAllowed(target.collection())) {
        throw new InvalidJobParametersException(
            "collection is not allowed for cleanup: " + target.collection());
      }
      if (!CollectionCleanupRepository.isValidIdentifier(target.timestampField())) {
        throw new InvalidJobParametersException(
            "invalid timestampField for " + target.collection() + ": " + target.timestampField());
      }
    }
  }

  @Override
  public JobResult execute(JobContext context) {
    final boolean dryRun = context.parameters().getBoolean(DRY_RUN, false);
    final List<CleanupTarget> targets = parseTargets(context.parameters());
    final Instant now = context.startedAt();
    final List<Map<String, Object>> results = new ArrayList<>();
    final List<String> errors = new ArrayList<>();
    int succeeded = 0;
    long affected = 0;

    for (CleanupTarget target : targets) {
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("collection", target.collection());
      if (Thread.currentThread().isInterrupted()) {
        entry.put("status", "skipped");
        entry.put("error", "interrupted");
        errors.add(target.collection() + ": interrupted");
        results.add(entry);
        continue;
      }
      final Instant threshold = now.minus(Duration.ofDays(target.ageThresholdDays()));
      try {
        final int count =
            dryRun
                ? cleanupRepository.countOlderThan(
                    target.collection(), target.timestampField(), threshold)
                : cleanupRepository.deleteOlderThan(
                    target.collection(), target.timestampField(), threshold);
        entry.put(dryRun ? "matched" : "deleted", count);
        entry.put("status", "success");
        succeeded++;
        affected += count;
        logger.info(
            "cleanup target finished collection={} {}={} threshold={}",
            target.collection(),
            dryRun ? "matched" : "deleted",
            count,
            threshold);
      } catch (RuntimeException ex) {
        entry.put("status", "failed");
        entry.put("error", ex.getMessage());
        errors.add(target.collection() + ": " + ex.getMessage());
        logger.warn("cleanup target failed collection={}", target.collection(), ex);
      }
      results.add(entry);
    }

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("dryRun", dryRun);
    detail.put("targets", results);
    final String message =
        String.format(
            "cleanup %s %d rows across %d/%d targets",
            dryRun ? "matched" : "deleted", affected, succeeded, targets.size());
    if (errors.isEmpty()) {
      return JobResult.success(message, detail);
    }
    if (succeeded == 0) {
      return JobResult.failure(message, detail, errors);
    }
    return JobResult.partial(message, detail, errors);
  }

  private List<CleanupTarget> parseTargets(JobParameters parameters) {
    final List<CleanupTarget> targets = new ArrayList<>();
    for (Map<String, Object> raw : parameters.getObjectList(TARGETS)) {
      final JobParameters target = JobParameters.of(raw);
      final String collection = target.getString("collection");
      if (collection == null) {
        throw new InvalidJobParametersException("each target requires a collection");
      }
      if (!target.contains("ageThresholdDays")) {
        throw new InvalidJobParametersException("ageThresholdDays is required for " + collection);
      }
      final int days = target.getInt("ageThresholdDays", 0, 1, MAX_AGE_DAYS);
      final String field = target.getString("timestampField");
      targets.add(new CleanupTarget(collection, days, field == null ? DEFAULT_TIMESTAMP_FIELD : field));
    }
    return targets;
  }
}
