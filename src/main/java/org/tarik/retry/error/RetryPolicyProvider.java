package org.tarik.retry.error;

/**
 * Capability of a unit of work to customize the way it's retried, without subclassing the executor.
 * The executor checks whether the operation implements this interface and applies the policy to that run only.
 */
public interface RetryPolicyProvider {
    RetryPolicy getRetryPolicy();
}
