/*
 * Where: Dispatch infrastructure configuration
 * What: Bounded pools for per-channel fan-out and for gateway calls
 * Why: Gateway calls get their own pool so a timed-out call cannot starve the fan-out
 */
package com.example.dispatch.config;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchExecutorConfig {

  public static final String FANOUT_EXECUTOR = "dispatchFanoutExecutor";
  public static final String GATEWAY_EXECUTOR = "gatewayCallExecutor";

  @Bean(name = FANOUT_EXECUTOR)
  public ThreadPoolTaskExecutor dispatchFanoutExecutor(DispatchExecutorProperties properties) {
    // saturated pool runs the branch on the caller instead of dropping a dispatch
    return build(
        "dispatch-fanout-",
        properties.fanoutPoolSize(),
        properties.queueCapacity(),
        new ThreadPoolExecutor.CallerRunsPolicy());
  }

  @Bean(name = GATEWAY_EXECUTOR)
  public ThreadPoolTaskExecutor gatewayCallExecutor(DispatchExecutorProperties properties) {
    // rejected calls fail fast so the caller's timeout always bounds a send
    return build(
        "gateway-call-",
        properties.gatewayPoolSize(),
        properties.queueCapacity(),
        new ThreadPoolExecutor.AbortPolicy());
  }

  private ThreadPoolTaskExecutor build(
      String prefix, int poolSize, int queueCapacity, RejectedExecutionHandler rejectionPolicy) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix(prefix);
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.setRejectedExecutionHandler(rejectionPolicy);
    return executor;
  }
}
