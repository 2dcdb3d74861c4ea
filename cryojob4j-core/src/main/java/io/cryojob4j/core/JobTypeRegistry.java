package io.cryojob4j.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves job type names, including historical aliases, to {@link JobType}.
 *
 * <p>Lookup is case-insensitive and ignores surrounding whitespace.
 */
public class JobTypeRegistry {

    private final Map<String, JobType> typesByAlias;

    public JobTypeRegistry() {
        this.typesByAlias = Arrays.stream(JobType.values())
                .flatMap(type -> Stream.concat(Stream.of(type.canonicalName()), type.aliases().stream())
                        .map(alias -> Map.entry(alias, type)))
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        Map.Entry::getValue,
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate job type alias shared by " + a + " and " + b);
                        }
                ));
    }

    public Optional<JobType> find(String alias) {
        if (alias == null || alias.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(typesByAlias.get(normalize(alias)));
    }

    public JobType getRequired(String alias) {
        return find(alias).orElseThrow(
                () -> new IllegalStateException("No job type registered for alias: " + alias));
    }

    public boolean isKnown(String alias) {
        return find(alias).isPresent();
    }

    public Set<String> allAliases() {
        return typesByAlias.keySet();
    }

    public Map<JobType, String> stageNames() {
        return Arrays.stream(JobType.values())
                .collect(Collectors.toUnmodifiableMap(Function.identity(), JobType::stageName));
    }

    private static String normalize(String alias) {
        return alias.trim().toLowerCase(Locale.ROOT);
    }
}
