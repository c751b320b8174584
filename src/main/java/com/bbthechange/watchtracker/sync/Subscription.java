package com.bbthechange.watchtracker.sync;

/**
 * Handle to a live store subscription.
 */
public interface Subscription {

    Subscription NONE = new Subscription() {
        @Override
        public void unsubscribe() {
        }

        @Override
        public boolean isActive() {
            return false;
        }
    };

    /**
     * Stop deliveries. Idempotent; once this returns no callback of the
     * subscription is started again.
     */
    void unsubscribe();

    boolean isActive();
}
