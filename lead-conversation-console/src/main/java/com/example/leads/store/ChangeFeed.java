package com.example.leads.store;

/**
 * Handle of one change-notification subscription. Closing is idempotent.
 */
public interface ChangeFeed extends AutoCloseable {

    RecordTable table();

    String organizationId();

    boolean isActive();

    @Override
    void close();
}
