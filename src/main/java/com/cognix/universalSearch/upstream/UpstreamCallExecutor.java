package com.cognix.universalSearch.upstream;

import com.cognix.universalSearch.config.UniversalSearchProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Runs external calls and converts every outcome into a {@link CallResult}.
 *
 * Nothing thrown by the call escapes: transport, status, parse and unexpected runtime
 * faults are all classified into a {@link FailureKind}. Retryable failures are attempted
 * again up to the configured number of attempts.
 */
@Slf4j
@Component
public class UpstreamCallExecutor {

    private final int maxAttempts;
    private final long backoffMs;

    @Autowired
    public UpstreamCallExecutor(UniversalSearchProperties properties) {
        this(properties.getUpstream().getMaxAttempts(), properties.getUpstream().getBackoffMs());
    }

    public UpstreamCallExecutor(int maxAttempts, long backoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    /**
     * A single external call; may throw anything.
     */
    @FunctionalInterface
    public interface UpstreamCall<T> {
        T execute() throws Exception;
    }

    /**
     * Executes the call, retrying transient failures.
     *
     * @param operation short label used in log lines (e.g. "github.search")
     * @param call the call to execute
     * @return success with the non-null payload, or the last failure
     */
    public <T> CallResult<T> call(String operation, UpstreamCall<T> call) {
        CallResult<T> result = attempt(operation, call);
        int attempt = 1;
        while (result.isRetryable() && attempt < maxAttempts) {
            log.debug("Retrying upstream call - operation: {}, attempt: {}, lastFailure: {}", operation, attempt + 1, result);
            if (!sleepBackoff()) {
                break;
            }
            result = attempt(operation, call);
            attempt++;
        }
        return result;
    }

    /**
     * Executes the call exactly once, whatever the configured attempt count. For best-effort
     * lookups whose latency budget leaves no room for a second try.
     */
    public <T> CallResult<T> callOnce(String operation, UpstreamCall<T> call) {
        return attempt(operation, call);
    }

    private <T> CallResult<T> attempt(String operation, UpstreamCall<T> call) {
        try {
            T value = call.execute();
            if (value == null) {
                return CallResult.failure(FailureKind.EMPTY, operation + " returned no body");
            }
            return CallResult.success(value);
        } catch (RestClientResponseException e) {
            return CallResult.httpFailure(e.getStatusCode().value(), operation + " answered " + e.getStatusCode());
        } catch (ResourceAccessException e) {
            return CallResult.failure(isTimeout(e) ? FailureKind.TIMEOUT : FailureKind.TRANSPORT,
                    operation + ": " + e.getMessage());
        } catch (RestClientException | JsonProcessingException e) {
            return CallResult.failure(FailureKind.MALFORMED, operation + ": " + e.getMessage());
        } catch (SocketTimeoutException | HttpTimeoutException e) {
            return CallResult.failure(FailureKind.TIMEOUT, operation + ": " + e.getMessage());
        } catch (IOException e) {
            return CallResult.failure(FailureKind.TRANSPORT, operation + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.failure(FailureKind.UNEXPECTED, operation + " interrupted");
        } catch (Exception e) {
            log.debug("Unexpected failure in upstream call - operation: {}", operation, e);
            return CallResult.failure(FailureKind.UNEXPECTED, operation + ": " + e);
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private boolean sleepBackoff() {
        if (backoffMs == 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
