package com.mintledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Request handling settings for the mint API.
 */
@ConfigurationProperties(prefix = "mintledger.api")
@NoArgsConstructor
@Getter
@Setter
public class ApiProperties {

    /** Page size used when the caller sends none or a non-positive one. */
    private int defaultPageSize = 10;

    /** Upper bound for the caller-supplied page size; larger values are clamped. */
    private int maxPageSize = 100;

    /** Echo storage error details to callers. Enable only outside production. */
    private boolean exposeErrorDetails = false;
}
