package io.cryojob4j.core;

import java.util.List;

/**
 * The processing stages the compiler knows how to build.
 */
public enum JobType {

    MOTION_CORRECTION("motion_correction", "MotionCorr", ComputeTier.MPI, "motioncorr"),
    CTF_ESTIMATION("ctf_estimation", "CtfFind", ComputeTier.MPI, "ctf"),
    CLASS_2D("class_2d", "Class2D", ComputeTier.GPU, "class2d", "classification_2d"),
    AUTO_REFINE("auto_refine", "AutoRefine", ComputeTier.GPU, "autorefine", "refine3d"),
    CTF_REFINE("ctf_refine", "CtfRefine", ComputeTier.MPI, "ctfrefine"),
    MULTIBODY("multibody", "Multibody", ComputeTier.GPU, "multi_body"),
    DYNAMIGHT("dynamight", "Dynamight", ComputeTier.GPU);

    private final String canonicalName;
    private final String stageName;
    private final ComputeTier computeTier;
    private final List<String> aliases;

    JobType(String canonicalName, String stageName, ComputeTier computeTier, String... aliases) {
        this.canonicalName = canonicalName;
        this.stageName = stageName;
        this.computeTier = computeTier;
        this.aliases = List.of(aliases);
    }

    public String canonicalName() {
        return canonicalName;
    }

    /**
     * Project sub-directory holding this stage's jobs (e.g. "Class2D").
     */
    public String stageName() {
        return stageName;
    }

    public ComputeTier computeTier() {
        return computeTier;
    }

    /**
     * Historical names, excluding the canonical one.
     */
    public List<String> aliases() {
        return aliases;
    }
}
