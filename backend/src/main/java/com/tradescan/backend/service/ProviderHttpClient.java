package com.tradescan.backend.service;

import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.model.Provider;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Raw HTTP to providers. One invocation is exactly one outbound request; quota and retries live above this class.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderHttpClient {

    private final RestTemplate providerRestTemplate;
    private final CircuitBreakerRegistry providerCircuitBreakers;
    private final MetricsService metricsService;
    private final Clock clock;

    public String get(Provider provider, String url, HttpHeaders headers) {
        return execute(provider, HttpMethod.GET, url, headers, null);
    }

    public String post(Provider provider, String url, HttpHeaders headers, String body) {
        return execute(provider, HttpMethod.POST, url, headers, body);
    }

    private String execute(Provider provider, HttpMethod method, String url, HttpHeaders headers, String body) {
        CircuitBreaker circuitBreaker = providerCircuitBreakers.circuitBreaker(provider.getKey());
        Supplier<String> call = CircuitBreaker.decorateSupplier(circuitBreaker,
                () -> doRequest(provider, method, url, headers, body));
        Instant started = clock.instant();
        boolean success = false;
        try {
            String response = call.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            log.warn("{} circuit open, refusing {} {}", provider.getKey(), method, url);
            throw new ProviderCallException(provider, provider.getKey() + " circuit breaker open", e);
        } finally {
            metricsService.recordProviderLatency(provider, method.name(), success,
                    Duration.between(started, clock.instant()));
        }
    }

    private String doRequest(Provider provider, HttpMethod method, String url, HttpHeaders headers, String body) {
        HttpHeaders requestHeaders = new HttpHeaders();
        if (headers != null) {
            requestHeaders.putAll(headers);
        }
        requestHeaders.setAccept(java.util.List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            requestHeaders.setContentType(MediaType.APPLICATION_JSON);
        }
        try {
            ResponseEntity<String> response = providerRestTemplate.exchange(url, method,
                    new HttpEntity<>(body, requestHeaders), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("{} answered 429 for {} {}", provider.getKey(), method, url);
            throw ProviderCallException.transientFailure(provider, provider.getKey() + " rate limited", 429, e);
        } catch (HttpServerErrorException e) {
            int status = e.getStatusCode().value();
            throw ProviderCallException.transientFailure(provider,
                    provider.getKey() + " server error (" + status + "): " + e.getResponseBodyAsString(), status, e);
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            throw new ProviderCallException(provider,
                    provider.getKey() + " error (" + status + "): " + e.getResponseBodyAsString(), status, false, e);
        } catch (ResourceAccessException e) {
            log.warn("{} network error for {} {}: {}", provider.getKey(), method, url, e.getMessage());
            throw ProviderCallException.transientFailure(provider, provider.getKey() + " unreachable: " + e.getMessage(),
                    null, e);
        }
    }
}
