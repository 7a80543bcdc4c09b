package com.cognix.universalSearch.upstream;

/**
 * Why an external call did not produce a usable payload.
 */
public enum FailureKind {

    /** Connect or read timeout exceeded. */
    TIMEOUT,

    /** Upstream answered with a non-2xx status. */
    HTTP_STATUS,

    /** Any other I/O failure (DNS, refused connection, reset). */
    TRANSPORT,

    /** Body could not be read or does not have the expected shape. */
    MALFORMED,

    /** 2xx without a body, or a lookup with no match. */
    EMPTY,

    /** Anything else thrown while executing the call. */
    UNEXPECTED;

    /**
     * Whether a second attempt has a chance of succeeding.
     */
    public boolean isTransient() {
        return this == TIMEOUT || this == TRANSPORT;
    }
}
