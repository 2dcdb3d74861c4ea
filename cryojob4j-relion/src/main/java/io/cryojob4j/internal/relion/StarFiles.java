package io.cryojob4j.internal.relion;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal STAR-file reads needed during validation.
 */
final class StarFiles {

    private static final Pattern COLUMN_INDEX = Pattern.compile("#(\\d+)");

    private StarFiles() {
    }

    /**
     * Path in the first data row of the first loop that has a movie or micrograph column.
     * {@code _rlnMicrographMovieName} is preferred over {@code _rlnMicrographName}.
     */
    static Optional<String> firstMoviePath(Path star) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(star, StandardCharsets.UTF_8)) {
            int movieCol = -1;
            int micrographCol = -1;
            boolean inLoop = false;

            String raw;
            while ((raw = reader.readLine()) != null) {
                String line = raw.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                if (line.equals("loop_")) {
                    inLoop = true;
                    movieCol = -1;
                    micrographCol = -1;
                    continue;
                }
                if (line.startsWith("data_")) {
                    inLoop = false;
                    movieCol = -1;
                    micrographCol = -1;
                    continue;
                }
                if (inLoop && line.startsWith("_")) {
                    String[] parts = line.split("\\s+");
                    if (parts.length > 1) {
                        Matcher m = COLUMN_INDEX.matcher(parts[1]);
                        if (m.find()) {
                            int idx = Integer.parseInt(m.group(1)) - 1;
                            if (parts[0].equals("_rlnMicrographMovieName")) movieCol = idx;
                            if (parts[0].equals("_rlnMicrographName")) micrographCol = idx;
                        }
                    }
                    continue;
                }
                if (inLoop && (movieCol >= 0 || micrographCol >= 0)) {
                    String[] values = line.split("\\s+");
                    int col = movieCol >= 0 ? movieCol : micrographCol;
                    if (col < values.length) {
                        return Optional.of(values[col]);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * True when the file mentions the STAR label {@code field} anywhere.
     */
    static boolean containsField(Path star, String field) throws IOException {
        return Files.readString(star, StandardCharsets.UTF_8).contains(field);
    }
}
