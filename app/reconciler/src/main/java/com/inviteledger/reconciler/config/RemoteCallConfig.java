/*
 * Where: reconciler configuration
 * What: bounded worker pool that runs provisioning calls
 * Why: remote calls must never block the scheduler threads past their timeout
 */
package com.inviteledger.reconciler.config;

import com.inviteledger.common.schedule.SingleFlightGuard;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RemoteCallConfig {

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService remoteCallExecutorService(RemoteCallProperties properties) {
    final AtomicInteger sequence = new AtomicInteger();
    final ThreadFactory threadFactory =
        runnable -> {
          final Thread thread = new Thread(runnable, "remote-call-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.poolSize(), threadFactory);
  }

  @Bean
  SingleFlightGuard singleFlightGuard() {
    return new SingleFlightGuard();
  }
}
