package com.example.webcrawler;

/**
 * Decides whether a failed fetch is attempted again by the same worker.
 */
public interface RetryPolicy {
    /**
     * @param result  outcome of the last attempt
     * @param attempt number of attempts made so far, starting at 1
     */
    boolean shouldRetry(FetchResult result, int attempt);

    /**
     * Failed URLs are recorded and never fetched again.
     */
    RetryPolicy NO_RETRY = (result, attempt) -> false;

    /**
     * Retries timeouts and transport errors up to {@code maxAttempts} attempts in total.
     */
    static RetryPolicy onFailure(int maxAttempts) {
        return (result, attempt) -> !result.isSuccess() && attempt < maxAttempts;
    }
}
