/*
 * Where: pipeline configuration
 * What: bounded thread pools for job dispatch, job execution and channel sends
 * Why: timeouts are enforced by waiting on futures from a separate pool
 */
package com.example.matrimony.pipeline.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class ExecutorConfig {

  public static final String JOB_DISPATCH_EXECUTOR = "jobDispatchExecutor";
  public static final String JOB_EXECUTION_EXECUTOR = "jobExecutionExecutor";
  public static final String CHANNEL_SEND_EXECUTOR = "channelSendExecutor";

  @Bean(name = JOB_DISPATCH_EXECUTOR, destroyMethod = "shutdownNow")
  @Qualifier(JOB_DISPATCH_EXECUTOR)
  public ExecutorService jobDispatchExecutor(SchedulerProperties properties) {
    // rejection is reported to the scheduler, which releases the claim it just took
    return boundedPool(
        properties.workerPoolSize(), "job-dispatch-", new ThreadPoolExecutor.AbortPolicy());
  }

  @Bean(name = JOB_EXECUTION_EXECUTOR, destroyMethod = "shutdownNow")
  @Qualifier(JOB_EXECUTION_EXECUTOR)
  public ExecutorService jobExecutionExecutor(SchedulerProperties properties) {
    return boundedPool(
        properties.workerPoolSize(), "job-exec-", new ThreadPoolExecutor.AbortPolicy());
  }

  @Bean(name = CHANNEL_SEND_EXECUTOR, destroyMethod = "shutdownNow")
  @Qualifier(CHANNEL_SEND_EXECUTOR)
  public ExecutorService channelSendExecutor(DeliveryProperties properties) {
    return boundedPool(
        properties.senderPoolSize(), "channel-send-", new ThreadPoolExecutor.AbortPolicy());
  }

  private ExecutorService boundedPool(
      int size, String threadNamePrefix, RejectedExecutionHandler handler) {
    final CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadNamePrefix);
    threadFactory.setDaemon(true);
    return new ThreadPoolExecutor(
        size, size, 60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(size * 4), threadFactory, handler);
  }
}
