package com.example.summarizer_backend.selector;

/**
 * What budgeted selection does with a candidate longer than the budget that is still left.
 */
public enum OverflowPolicy {
    /** Admit it while the budget is not yet reached, then stop. Overshoot is at most one candidate. */
    ADMIT_THEN_STOP,
    /** Never exceed the budget: skip it and keep scanning for shorter candidates. */
    STRICT,
    /** Admit it cut down to the remaining budget if enough remains, then stop. */
    TRIM
}
