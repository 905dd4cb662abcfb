package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

/**
 * Named events a post can be subjected to.
 */
public enum LifecycleEvent {
    SUBMIT_FOR_REVIEW,
    APPROVE,
    REJECT,
    SCHEDULE,
    UNSCHEDULE,
    PUBLISH_SUCCESS,
    PUBLISH_FAILED,
    RETRY,
    ARCHIVE,
    EDIT,
    DELETE
}
