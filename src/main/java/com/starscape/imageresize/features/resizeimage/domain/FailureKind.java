package com.starscape.imageresize.features.resizeimage.domain;

/**
 * Classification of a terminal per-record failure.
 */
public enum FailureKind {
    /** Source bytes are not a decodable image. */
    DECODE,
    /** Metadata cannot be compared, e.g. a zero-byte original. */
    DEGENERATE_METADATA,
    /** Fetch from or store to object storage failed. */
    STORAGE,
    /** The audit record could not be written. */
    PERSISTENCE,
    /** The notification itself is malformed, e.g. an undecodable object key. */
    INVALID_RECORD,
    UNEXPECTED
}
