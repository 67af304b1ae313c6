package com.wagerdesk.warehouse;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the statistics warehouse.
 *
 * <pre>
 * warehouse:
 *   base-url: http://localhost:8090
 *   connect-timeout: 5s
 *   response-timeout: 10s
 *   head-to-head-limit: 10
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "warehouse")
public record WarehouseProperties(
    @NotBlank String baseUrl,
    Duration connectTimeout,
    Duration responseTimeout,
    @Positive Integer headToHeadLimit
) {
    public WarehouseProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8090";
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(5);
        if (responseTimeout == null) responseTimeout = Duration.ofSeconds(10);
        if (headToHeadLimit == null) headToHeadLimit = 10;
    }
}
