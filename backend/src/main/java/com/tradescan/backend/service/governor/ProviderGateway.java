package com.tradescan.backend.service.governor;

import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.model.Provider;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;

/**
 * Single governed calls with retry. Each retry attempt goes back through the governor and counts against quota.
 */
@Service
@RequiredArgsConstructor
public class ProviderGateway {

    private final RequestGovernor requestGovernor;
    private final RetryRegistry providerRetries;

    /** Idempotent read, retried on transient failures. */
    public <T> T fetch(Provider provider, Callable<T> call) {
        return fetch(provider, call, RequestOptions.normal());
    }

    public <T> T fetch(Provider provider, Callable<T> call, RequestOptions options) {
        Retry retry = providerRetries.retry(provider.getKey());
        Callable<T> governed = () -> requestGovernor.execute(provider, call, options);
        try {
            return Retry.decorateCallable(retry, governed).call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderCallException(provider, provider.getKey() + " call failed: " + e.getMessage(), e);
        }
    }

    /** Non-idempotent call such as an order submission: high priority, never retried. */
    public <T> T send(Provider provider, Callable<T> call) {
        return requestGovernor.execute(provider, call, RequestOptions.high());
    }
}
