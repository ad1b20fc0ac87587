package io.proofproxy.server;

/**
 * Per-client admission of submissions, checked before a job reaches the dispatcher.
 */
public interface RateLimiter {

    /**
     * Non-blocking.
     *
     * @param clientKey identifies the client, typically its address
     * @return false if the client is over its limit
     */
    boolean tryAcquire(String clientKey);

    /**
     * @return requests allowed per second, 0 when unlimited
     */
    int getLimit();

    static RateLimiter unlimited() {
        return new RateLimiter() {
            @Override
            public boolean tryAcquire(String clientKey) {
                return true;
            }

            @Override
            public int getLimit() {
                return 0;
            }
        };
    }
}
