package com.devision.corsgateway.requestlog;

import java.util.Map;

public record RequestStats(
        long totalRequests,
        int recentRequests,
        long averageResponseTime,
        long successRate,
        Map<String, Long> topOrigins,
        Map<String, Long> topApiKeys,
        Map<String, Long> statusCodes
) {
}
