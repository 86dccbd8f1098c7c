package com.govsense.pipeline.scheduler;

import com.govsense.pipeline.model.RefreshCompletedEvent;

/**
 * Subscriber to successful refreshes. Called on the refresh thread after
 * every table of the run has been committed.
 */
public interface RefreshListener {

    void onRefreshCompleted(RefreshCompletedEvent event);
}
