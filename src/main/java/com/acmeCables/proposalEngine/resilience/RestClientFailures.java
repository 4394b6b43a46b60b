package com.acmeCables.proposalEngine.resilience;

import com.acmeCables.proposalEngine.resilience.exception.CollaboratorRejectedException;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

/**
 * Maps REST client failures onto the retry policy's error families.
 *
 * <p>A 4xx response is a rejection and is not retried, except 408 and 429. Server errors,
 * transport failures and unreadable bodies are upstream-unavailable and retried.</p>
 */
public final class RestClientFailures {

    private RestClientFailures() {
    }

    public static RuntimeException translate(String collaborator, RestClientException e) {
        if (e instanceof HttpClientErrorException clientError && !isTransient(clientError)) {
            return new CollaboratorRejectedException(
                    collaborator + " rejected the request: " + clientError.getStatusCode().value()
                            + " " + clientError.getStatusText(), e);
        }
        return new UpstreamUnavailableException("Failed to call " + collaborator + ": " + e.getMessage(), e);
    }

    private static boolean isTransient(HttpClientErrorException e) {
        int status = e.getStatusCode().value();
        return status == HttpStatus.TOO_MANY_REQUESTS.value() || status == HttpStatus.REQUEST_TIMEOUT.value();
    }
}
