package org.tarik.retry.exceptions;

import org.tarik.retry.dto.ResponseDetails;

import java.util.Optional;

/**
 * Exception which carries the HTTP response of a failed call, so that response aware strategies can inspect it.
 */
public class HttpResponseException extends RuntimeException implements ResponseAware {
    private final ResponseDetails response;

    public HttpResponseException(ResponseDetails response) {
        this("HTTP request failed with status " + response.statusCode(), response);
    }

    public HttpResponseException(String message, ResponseDetails response) {
        super(message);
        this.response = response;
    }

    public HttpResponseException(String message, ResponseDetails response, Throwable cause) {
        super(message, cause);
        this.response = response;
    }

    @Override
    public Optional<ResponseDetails> getResponse() {
        return Optional.of(response);
    }
}
