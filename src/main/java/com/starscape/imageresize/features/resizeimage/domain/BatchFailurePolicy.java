package com.starscape.imageresize.features.resizeimage.domain;

/**
 * What the batch coordinator does when a record fails.
 */
public enum BatchFailurePolicy {
    /**
     * Stop at the first failed record and report the whole batch as failed.
     * Records after the failed one are left for the invoker's redrive.
     */
    HALT_ON_FIRST_FAILURE,
    /**
     * Attempt every record and report the failures in the summary.
     */
    CONTINUE_AND_AGGREGATE
}
