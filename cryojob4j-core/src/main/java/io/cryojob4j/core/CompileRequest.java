package io.cryojob4j.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One job submission handed to the compiler.
 *
 * <p>The project is located either by an explicit {@code projectRoot} or by folder/project name
 * under the configured projects root. {@code outputDir} is optional; when absent the compiler
 * derives {@code <projectRoot>/<stage>/<jobName>}.
 */
public final class CompileRequest {

    private final String jobType;
    private final JobParameters parameters;
    private final String jobName;
    private final Path projectRoot;
    private final String projectName;
    private final String folderName;
    private final Path outputDir;

    private CompileRequest(Builder b) {
        this.jobType = b.jobType;
        this.parameters = b.parameters;
        this.jobName = b.jobName;
        this.projectRoot = b.projectRoot;
        this.projectName = blankToNull(b.projectName);
        this.folderName = blankToNull(b.folderName);
        this.outputDir = b.outputDir;
    }

    /**
     * Job type name or alias (e.g. "class2d").
     */
    public String jobType() {
        return jobType;
    }

    public JobParameters parameters() {
        return parameters;
    }

    /**
     * Job directory name (e.g. "Job012").
     */
    public String jobName() {
        return jobName;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public String projectName() {
        return projectName;
    }

    public String folderName() {
        return folderName;
    }

    public Path outputDir() {
        return outputDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public static final class Builder {
        private String jobType;
        private JobParameters parameters = JobParameters.empty();
        private String jobName;
        private Path projectRoot;
        private String projectName;
        private String folderName;
        private Path outputDir;

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder parameters(JobParameters parameters) {
            this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
            return this;
        }

        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder projectRoot(Path projectRoot) {
            this.projectRoot = projectRoot;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder folderName(String folderName) {
            this.folderName = folderName;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public CompileRequest build() {
            if (jobType == null || jobType.isBlank()) {
                throw new IllegalArgumentException("jobType must not be blank");
            }
            if (jobName == null || jobName.isBlank()) {
                throw new IllegalArgumentException("jobName must not be blank");
            }
            boolean hasName = blankToNull(projectName) != null || blankToNull(folderName) != null;
            if (projectRoot == null && !hasName) {
                throw new IllegalStateException(
                        "CompileRequest must locate the project: projectRoot, folderName, or projectName"
                );
            }
            return new CompileRequest(this);
        }
    }
}
