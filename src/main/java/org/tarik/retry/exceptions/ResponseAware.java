package org.tarik.retry.exceptions;

import org.tarik.retry.dto.ResponseDetails;

import java.util.Optional;

/**
 * Implemented by exceptions which embed the response of the remote call that failed.
 */
public interface ResponseAware {
    Optional<ResponseDetails> getResponse();
}
