package com.github.dimitryivaniuta.scheduling.scheduler;

/** What a poll does with a due entry whose previous invocation has not returned yet. */
public enum OverlapPolicy {
    /** Dispatch anyway; invocations of the same entry may run concurrently. */
    ALLOW,
    /** Skip this tick; the entry is checked again on the next poll. */
    SKIP_IF_RUNNING
}
