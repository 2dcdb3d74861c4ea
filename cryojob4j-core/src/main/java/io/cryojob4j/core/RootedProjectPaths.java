package io.cryojob4j.core;

import java.nio.file.Path;
import java.util.Objects;

final class RootedProjectPaths implements ProjectPaths {

    private final Path root;

    RootedProjectPaths(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Path resolve(String ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        Path path = Path.of(ref);
        if (path.isAbsolute()) {
            return path;
        }
        return root.resolve(path).normalize();
    }

    @Override
    public String relativize(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path normalized = path.normalize();
        if (normalized.isAbsolute() && normalized.startsWith(root)) {
            return root.relativize(normalized).toString();
        }
        return path.toString();
    }

    @Override
    public String toString() {
        return "ProjectPaths[" + root + "]";
    }
}
