package com.directiveremover.cli.processing;

public enum ResultStatus {
    SUCCESS,
    /** Written, but at least one block carries a review marker. */
    SUCCESS_WITH_REVIEW,
    FAILED,
    SKIPPED
}
