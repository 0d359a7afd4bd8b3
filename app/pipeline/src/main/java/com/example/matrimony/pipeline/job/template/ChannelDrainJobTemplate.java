/*
 * Where: pipeline job templates
 * What: shared drain job for one delivery channel
 * Why: email, SMS and push drains differ only in channel and batch limits
 */
package com.example.matrimony.pipeline.job.template;

import com.example.matrimony.pipeline.delivery.DrainSummary;
import com.example.matrimony.pipeline.delivery.NotificationDeliveryService;
import com.example.matrimony.pipeline.job.InvalidJobParametersException;
import com.example.matrimony.pipeline.job.JobContext;
import com.example.matrimony.pipeline.job.JobParameters;
import com.example.matrimony.pipeline.job.JobResult;
import com.example.matrimony.pipeline.job.JobTemplate;
import com.example.matrimony.pipeline.model.NotificationChannel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public abstract class ChannelDrainJobTemplate implements JobTemplate {

  static final String BATCH_SIZE = "batchSize";
  static final String TEST_MODE = "testMode";
  static final String TEST_ADDRESS = "testAddress";

  private final NotificationDeliveryService deliveryService;
  private final NotificationChannel channel;
  private final int defaultBatchSize;
  private final int maxBatchSize;
  private final String legacyTestAddressKey;

  protected ChannelDrainJobTemplate(
      NotificationDeliveryService deliveryService,
      NotificationChannel channel,
      int defaultBatchSize,
      int maxBatchSize,
      String legacyTestAddressKey) {
    this.deliveryService = deliveryService;
    this.channel = channel;
    this.defaultBatchSize = defaultBatchSize;
    this.maxBatchSize = maxBatchSize;
    this.legacyTestAddressKey = legacyTestAddressKey;
  }

  @Override
  public void validateParameters(JobParameters parameters) {
    parameters.getInt(BATCH_SIZE, defaultBatchSize, 1, maxBatchSize);
    if (parameters.getBoolean(TEST_MODE, false) && testAddress(parameters) == null) {
      throw new InvalidJobParametersException(TEST_ADDRESS + " is required when testMode is true");
    }
  }

  @Override
  public JobResult execute(JobContext context) {
    final JobParameters parameters = context.parameters();
    final int batchSize = parameters.getInt(BATCH_SIZE, defaultBatchSize, 1, maxBatchSize);
    final boolean testMode = parameters.getBoolean(TEST_MODE, false);
    final String testAddress = testMode ? testAddress(parameters) : null;

    final DrainSummary summary = deliveryService.drain(channel, batchSize, testAddress);

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("channel", channel.value());
    detail.put("sent", summary.sent());
    detail.put("failed", summary.failed());
    detail.put("retried", summary.retried());
    detail.put("total", summary.total());
    detail.put("testMode", testMode);
    final String message =
        String.format(
            "%s drain sent=%d failed=%d retried=%d",
            channel.value(), summary.sent(), summary.failed(), summary.retried());
    if (summary.failed() == 0 && summary.retried() == 0) {
      return JobResult.success(message, detail);
    }
    return JobResult.partial(message, detail, List.of());
  }

  private String testAddress(JobParameters parameters) {
    final String address = parameters.getString(TEST_ADDRESS);
    if (address != null || legacyTestAddressKey == null) {
      return address;
    }
    return parameters.getString(legacyTestAddressKey);
  }
}
