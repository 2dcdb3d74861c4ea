package io.cryojob4j.core;

/**
 * Derived once per build from resolved parameters; selects the binary name and flag groups.
 */
public record ExecutionMode(
        boolean continuation,
        Parallelism parallelism,
        Accelerator accelerator
) {

    public enum Parallelism {
        SINGLE,
        MPI
    }

    public enum Accelerator {
        CPU,
        GPU
    }

    public static ExecutionMode of(boolean continuation, int mpiProcs, boolean gpu) {
        return new ExecutionMode(
                continuation,
                mpiProcs > 1 ? Parallelism.MPI : Parallelism.SINGLE,
                gpu ? Accelerator.GPU : Accelerator.CPU
        );
    }

    public boolean usesMpi() {
        return parallelism == Parallelism.MPI;
    }

    public boolean usesGpu() {
        return accelerator == Accelerator.GPU;
    }
}
