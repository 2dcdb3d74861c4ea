package io.cryojob4j.internal.relion;

import io.cryojob4j.JobCommandBuilder;
import io.cryojob4j.config.CompilerProperties;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.JobType;
import io.cryojob4j.core.ProjectPaths;

import java.util.Objects;

/**
 * Creates a fresh RELION builder per job. Builders are single-use and hold no shared state.
 */
public class RelionBuilderFactory {

    private final CompilerProperties props;

    public RelionBuilderFactory(CompilerProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    public JobCommandBuilder create(JobType type, JobParameters params, ProjectPaths paths) {
        Objects.requireNonNull(type, "type must not be null");
        return switch (type) {
            case MOTION_CORRECTION -> new MotionCorrectionBuilder(params, paths, props);
            case CTF_ESTIMATION -> new CtfEstimationBuilder(params, paths, props);
            case CLASS_2D -> new Class2dBuilder(params, paths, props);
            case AUTO_REFINE -> new AutoRefineBuilder(params, paths, props);
            case CTF_REFINE -> new CtfRefineBuilder(params, paths, props);
            case MULTIBODY -> new MultibodyBuilder(params, paths, props);
            case DYNAMIGHT -> new DynamightBuilder(params, paths, props);
        };
    }
}
