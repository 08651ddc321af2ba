package com.example.leads.store;

public interface ChangeListener {

    void onChange(ChangeEvent event);

    /**
     * Called when the feed stopped delivering for a reason other than {@link ChangeFeed#close()}.
     */
    default void onFeedLost(RecordTable table, String organizationId) {}
}
