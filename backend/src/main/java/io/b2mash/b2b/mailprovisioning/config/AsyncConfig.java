package io.b2mash.b2b.mailprovisioning.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Enables {@code @Async} so provisioning jobs run on Spring's task executor instead of the request
 * thread. Pool sizing comes from {@code spring.task.execution.*}.
 */
@Configuration
@EnableAsync
public class AsyncConfig {}
