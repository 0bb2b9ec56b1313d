package dev.lecturelens.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/** Activates {@code @Retryable} on citation persistence. */
@Configuration
@EnableRetry
public class RetryConfig {}
