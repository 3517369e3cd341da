package com.github.dimitryivaniuta.labelbridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated executor for audit writes. Bounded queue; when full, {@code AuditLog} drops and counts.
 */
@Configuration
public class AuditConfig {

    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor(LabelBridgeProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getAudit().getWriterThreads());
        executor.setMaxPoolSize(props.getAudit().getWriterThreads());
        executor.setQueueCapacity(props.getAudit().getQueueCapacity());
        executor.setThreadNamePrefix("audit-writer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
