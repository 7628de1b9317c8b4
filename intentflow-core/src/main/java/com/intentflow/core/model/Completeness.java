package com.intentflow.core.model;

/**
 * How much of the work done before a failure was reversed.
 */
public enum Completeness {
    /** No succeeded step left an effect or defined a compensation, nothing to reverse. */
    NOT_REQUIRED,
    /** Every succeeded step was compensated. */
    FULL,
    /** Some succeeded steps were compensated, others lacked a compensation or it failed. */
    PARTIAL,
    /** Steps had succeeded but none of them was compensated. */
    NONE;

    /**
     * @param succeeded Forward steps that succeeded
     * @param reversible Succeeded steps that have side effects or define a compensation
     * @param compensated Compensations that succeeded
     */
    public static Completeness of(int succeeded, int reversible, int compensated) {
        if (succeeded == 0 || reversible == 0) {
            return NOT_REQUIRED;
        }
        if (compensated >= succeeded) {
            return FULL;
        }
        return compensated == 0 ? NONE : PARTIAL;
    }
}
