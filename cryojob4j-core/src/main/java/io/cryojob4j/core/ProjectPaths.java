package io.cryojob4j.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Maps logical file references to paths inside one project and back.
 */
public interface ProjectPaths {

    Path root();

    /**
     * Absolute references are returned as-is; anything else is taken relative to {@link #root()}.
     */
    Path resolve(String ref);

    /**
     * Project-relative form of {@code path}, or the path unchanged when it lies outside the project.
     */
    String relativize(Path path);

    static ProjectPaths rootedAt(Path root) {
        return new RootedProjectPaths(root);
    }

    /**
     * Project directory under {@code projectsRoot}: the folder name when set, otherwise the project
     * name with spaces replaced by underscores.
     */
    static ProjectPaths forProject(Path projectsRoot, String folderName, String projectName) {
        Objects.requireNonNull(projectsRoot, "projectsRoot must not be null");
        String folder;
        if (folderName != null && !folderName.isBlank()) {
            folder = folderName;
        } else if (projectName != null && !projectName.isBlank()) {
            folder = projectName.replace(' ', '_');
        } else {
            throw new IllegalArgumentException("folderName or projectName is required");
        }
        return new RootedProjectPaths(projectsRoot.resolve(folder));
    }
}
