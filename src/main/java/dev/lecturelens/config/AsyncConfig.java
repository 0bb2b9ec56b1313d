package dev.lecturelens.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for work kept off request and socket threads.
 *
 * <p>{@code ragQueryExecutor} runs citation queries for REST calls and session streams;
 * {@code citationPersistenceExecutor} runs fire-and-forget citation writes.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "ragQueryExecutor")
  public Executor ragQueryExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("rag-query-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "citationPersistenceExecutor")
  public Executor citationPersistenceExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("citation-persist-");
    executor.initialize();
    return executor;
  }
}
