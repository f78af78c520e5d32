package com.codelogickeep.agent.team.framework.adapter;

import com.codelogickeep.agent.team.exception.BackendException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import com.codelogickeep.agent.team.framework.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Shared HTTP plumbing for the provider adapters: asynchronous send linked to the
 * cancellation token, and mapping of transport and status failures to {@link BackendException}.
 */
abstract class HttpLlmAdapter implements LlmAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpLlmAdapter.class);

    protected final HttpClient httpClient;
    protected final Duration timeout;
    protected final boolean logRequests;

    protected HttpLlmAdapter(Duration timeout, boolean logRequests) {
        this.timeout = timeout;
        this.logRequests = logRequests;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
    }

    /**
     * Sends the request and returns the body of a 200 response.
     */
    protected String send(HttpRequest request, CancellationToken cancellation) {
        if (logRequests) {
            log.info("Request to {} ({})", request.uri(), getName());
        }

        CompletableFuture<HttpResponse<String>> future =
                cancellation.link(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()));

        HttpResponse<String> response;
        try {
            response = future.get();
        } catch (CancellationException e) {
            throw new BackendException(ErrorCode.BACKEND_CANCELLED, getName() + " request cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BackendException(ErrorCode.BACKEND_CANCELLED, getName() + " request interrupted", e);
        } catch (ExecutionException e) {
            throw mapTransportFailure(e.getCause());
        }

        if (logRequests) {
            log.info("Response: {}", response.body());
        }

        if (response.statusCode() != 200) {
            log.error("API error: {} - {}", response.statusCode(), response.body());
            throw BackendException.fromStatus(response.statusCode(), response.body());
        }

        return response.body();
    }

    protected JsonNode parseJson(String body) {
        try {
            return JsonUtil.parse(body);
        } catch (JsonProcessingException e) {
            throw malformed("Response is not valid JSON", e);
        }
    }

    protected BackendException malformed(String message, Throwable cause) {
        return new BackendException(ErrorCode.BACKEND_MALFORMED_RESPONSE, getName() + ": " + message, cause);
    }

    private BackendException mapTransportFailure(Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return new BackendException(ErrorCode.BACKEND_TIMEOUT,
                    getName() + " request timed out after " + timeout.toSeconds() + "s", cause);
        }
        if (cause instanceof CancellationException) {
            return new BackendException(ErrorCode.BACKEND_CANCELLED, getName() + " request cancelled", cause);
        }
        if (cause instanceof IOException) {
            return new BackendException(ErrorCode.BACKEND_NETWORK,
                    getName() + " request failed: " + cause.getMessage(), cause);
        }
        return new BackendException(ErrorCode.BACKEND_REQUEST_FAILED,
                getName() + " request failed: " + cause, cause);
    }
}
