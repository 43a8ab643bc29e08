package com.starscape.imageresize.features.resizeimage.domain;

/**
 * Figures derived from comparing the original and resized metadata.
 *
 * @param reductionPercentage whole-percent byte-size reduction, negative when the resized file grew
 * @param dimensionChange     human-readable change, e.g. {@code 2000x1000 → 1000x500}
 */
public record DerivedMetrics(
    int reductionPercentage,
    String dimensionChange
) {}
