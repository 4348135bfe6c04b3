package com.z254.argus.search;

/**
 * Raw index hit: internal position and native distance (smaller is closer).
 */
public record Neighbor(int position, float distance) {
}
