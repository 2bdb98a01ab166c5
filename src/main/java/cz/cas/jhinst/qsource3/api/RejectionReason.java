package cz.cas.jhinst.qsource3.api;

/**
 * Why an outbound request was refused.
 */
public enum RejectionReason
{
    /** The broker session is not established; nothing was mutated or sent. */
    NOT_CONNECTED,

    /** The value failed validation; nothing was mutated or sent. */
    VALIDATION_FAILURE
}
