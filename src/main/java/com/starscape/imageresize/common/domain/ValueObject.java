package com.starscape.imageresize.common.domain;

/**
 * Marker for immutable, self-validating domain values.
 */
public interface ValueObject {
}
