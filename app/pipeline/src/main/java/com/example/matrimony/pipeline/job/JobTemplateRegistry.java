/*
 * Where: pipeline job layer
 * What: template type to JobTemplate lookup built from the context's templates
 * Why: duplicate or blank type names are rejected at startup rather than at dispatch
 */
package com.example.matrimony.pipeline.job;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JobTemplateRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobTemplateRegistry.class);

  private final Map<String, JobTemplate> templates;

  public JobTemplateRegistry(List<JobTemplate> jobTemplates) {
    final Map<String, JobTemplate> byType = new TreeMap<>();
    for (JobTemplate template : jobTemplates) {
      final String type = template.type();
      if (type == null || type.isBlank()) {
        throw new IllegalStateException(
            "job template has a blank type: " + template.getClass().getName());
      }
      final JobTemplate previous = byType.putIfAbsent(type, template);
      if (previous != null) {
        throw new IllegalStateException(
            "duplicate job template type="
                + type
                + " classes="
                + previous.getClass().getName()
                + ","
                + template.getClass().getName());
      }
    }
    this.templates = Collections.unmodifiableMap(byType);
    logger.info("job templates registered types={}", templates.keySet());
  }

  public Optional<JobTemplate> find(String type) {
    return Optional.ofNullable(type == null ? null : templates.get(type));
  }

  public Set<String> types() {
    return templates.keySet();
  }
}
