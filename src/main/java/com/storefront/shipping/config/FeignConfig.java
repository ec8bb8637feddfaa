package com.storefront.shipping.config;

import feign.Logger;
import feign.RetryableException;
import feign.Retryer;
import feign.codec.ErrorDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Retry and error handling shared by the rule store, buyer profile and cart clients.
 * Retrying transient I/O failures is the clients' job; the estimate engine never retries.
 */
@Configuration
@Slf4j
public class FeignConfig {

    // Statuses worth retrying: the collaborator is restarting, overloaded or rate limiting us
    static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);

    @Value("${services.retry.period-ms:100}")
    private long retryPeriodMs;

    @Value("${services.retry.max-period-ms:1000}")
    private long retryMaxPeriodMs;

    @Value("${services.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${services.logger-level:BASIC}")
    private Logger.Level loggerLevel;

    @Bean
    public Retryer feignRetryer() {
        return new Retryer.Default(retryPeriodMs, retryMaxPeriodMs, retryMaxAttempts);
    }

    @Bean
    public Logger.Level feignLoggerLevel() {
        return loggerLevel;
    }

    /**
     * Turns transient HTTP statuses into {@link RetryableException} so the {@link Retryer}
     * picks them up; everything else keeps Feign's default decoding.
     */
    @Bean
    public ErrorDecoder feignErrorDecoder() {
        final ErrorDecoder defaultErrorDecoder = new ErrorDecoder.Default();

        return (methodKey, response) -> {
            Exception decoded = defaultErrorDecoder.decode(methodKey, response);
            int status = response.status();
            if (!isTransient(status) || decoded instanceof RetryableException) {
                return decoded;
            }

            log.warn("{} answered {}; scheduling a retry.", methodKey, status);
            return new RetryableException(
                    status,
                    "Collaborator responded with transient error " + status + ", retrying...",
                    response.request().httpMethod(),
                    decoded,
                    (Long) null,
                    response.request()
            );
        };
    }

    static boolean isTransient(int status) {
        return TRANSIENT_STATUSES.contains(status);
    }
}
