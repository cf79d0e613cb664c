package com.linter.results.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Position of a finding inside an analyzed file.
 * Line and character are optional; an absent character is distinct from character 0.
 *
 * @param file      the file path
 * @param line      the line number, or null
 * @param character the column, or null
 */
public record Location(String file, Integer line, Integer character) {

    public Location {
        Objects.requireNonNull(file, "file is required");
    }

    public static Location of(String file, int line, int character) {
        return new Location(file, line, character);
    }

    public static Location ofLine(String file, int line) {
        return new Location(file, line, null);
    }

    public Optional<Integer> column() {
        return Optional.ofNullable(character);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(file);
        if (line != null) {
            sb.append(':').append(line);
            if (character != null) {
                sb.append(':').append(character);
            }
        }
        return sb.toString();
    }
}
