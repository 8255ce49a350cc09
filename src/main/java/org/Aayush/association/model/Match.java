package org.Aayush.association.model;

/**
 * Matched pair of positions in the caller's track and detection collections.
 */
public record Match(int trackIndex, int detectionIndex) {
}
