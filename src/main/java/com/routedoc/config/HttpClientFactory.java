package com.routedoc.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Creates the HTTP client used to fetch route manifests from running services.
 */
@Configuration
public class HttpClientFactory {

    /**
     * A {@link WebClient} that retries a fetch answered with 429 or 503, up to 3 attempts with an
     * exponential backoff starting at 500ms.
     */
    @Bean
    public WebClient webClient() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnException(e -> e instanceof WebClientResponseException.ServiceUnavailable
                        || e instanceof WebClientResponseException.TooManyRequests)
                .build();

        Retry retry = RetryRegistry.of(config).retry("route-manifest-http");

        return WebClient.builder()
                .filter((request, next) -> next.exchange(request)
                        .flatMap(HttpClientFactory::failOnRetryableStatus)
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    // exchange() completes normally on any status, so retryable ones are turned into errors here
    private static Mono<ClientResponse> failOnRetryableStatus(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == 429 || status == 503) {
            return response.createException().flatMap(Mono::error);
        }
        return Mono.just(response);
    }
}
