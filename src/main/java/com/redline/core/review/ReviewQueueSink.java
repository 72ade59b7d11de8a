package com.redline.core.review;

/**
 * Outbound notification to whatever owns the review queue. Fire-and-forget: callers do
 * not wait on, or react to, the sink's own failures.
 */
public interface ReviewQueueSink {

    void createReviewItem(ReviewItem item);
}
