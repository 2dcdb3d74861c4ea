package io.cryojob4j.core;

/**
 * Which kind of cluster resources a stage is normally scheduled on.
 */
public enum ComputeTier {
    MPI,
    GPU
}
