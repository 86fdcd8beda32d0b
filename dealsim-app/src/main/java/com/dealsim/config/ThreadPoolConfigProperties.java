package com.dealsim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Shared pool settings, prefix {@code thread.pool.executor.config}. Backs the pool that runs
 * fire-and-forget evaluation calls.
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    private Integer corePoolSize = 4;

    private Integer maxPoolSize = 16;

    /** seconds */
    private Long keepAliveTime = 10L;

    private Integer blockQueueSize = 1000;

    /**
     * AbortPolicy, DiscardPolicy, DiscardOldestPolicy or CallerRunsPolicy.
     */
    private String policy = "AbortPolicy";

}
