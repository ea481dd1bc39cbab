package com.clarifi.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "clarifi.dashboard")
public record DashboardProperties(
        Integer recentTransactionsLimit,
        Duration fetchTimeout,
        Integer defaultTrendMonths,
        Integer maxTrendMonths,
        Integer executorCorePoolSize,
        Integer executorMaxPoolSize,
        Integer executorQueueCapacity
) {
    public DashboardProperties {
        if (recentTransactionsLimit == null || recentTransactionsLimit <= 0) {
            recentTransactionsLimit = 10;
        }
        if (fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            fetchTimeout = Duration.ofSeconds(10);
        }
        if (defaultTrendMonths == null || defaultTrendMonths <= 0) {
            defaultTrendMonths = 6;
        }
        if (maxTrendMonths == null || maxTrendMonths < defaultTrendMonths) {
            maxTrendMonths = Math.max(24, defaultTrendMonths);
        }
        if (executorCorePoolSize == null || executorCorePoolSize <= 0) {
            executorCorePoolSize = 5;
        }
        if (executorMaxPoolSize == null || executorMaxPoolSize < executorCorePoolSize) {
            executorMaxPoolSize = Math.max(20, executorCorePoolSize);
        }
        if (executorQueueCapacity == null || executorQueueCapacity < 0) {
            executorQueueCapacity = 500;
        }
    }

    public static DashboardProperties defaults() {
        return new DashboardProperties(null, null, null, null, null, null, null);
    }
}
