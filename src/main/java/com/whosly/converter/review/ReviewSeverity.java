package com.whosly.converter.review;

public enum ReviewSeverity {
    /** Will prevent compilation or execution on the target. */
    ERROR,
    /** May cause runtime problems or performance degradation. */
    WARNING,
    /** Best-practice recommendation. */
    INFO
}
