package io.quarkus.qe.perf.regression.detector.cli;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

final class CommandUtils {

    private CommandUtils() {
    }

    /**
     * Parses the start time in various formats to an Instant.
     * Supports:
     * - epoch seconds (e.g., 1768003200)
     * - ISO-8601 instant (e.g., 2026-01-10T00:00:00Z)
     * - d.M.yyyy (e.g., 10.1.2026)
     * - yyyy-MM-dd (e.g., 2026-01-10)
     * Returns null if the value is null, allowing the caller to pick the default.
     */
    static Instant parseDate(String value) {
        if (value == null) {
            return null;
        }

        if (value.chars().allMatch(Character::isDigit) && !value.isEmpty()) {
            return Instant.ofEpochSecond(Long.parseLong(value));
        }

        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            // not an instant, try date formats
        }

        try {
            LocalDate date = LocalDate.parse(value, DateTimeFormatter.ofPattern("d.M.yyyy"));
            return date.atStartOfDay(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            // not d.M.yyyy
        }

        try {
            LocalDate date = LocalDate.parse(value);
            return date.atStartOfDay(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Invalid start time: '" + value + "'. " +
                            "Expected epoch seconds (e.g., 1768003200), d.M.yyyy (e.g., 10.1.2026), " +
                            "yyyy-MM-dd (e.g., 2026-01-10) or ISO-8601 instant (e.g., 2026-01-10T00:00:00Z)");
        }
    }

    /**
     * Splits comma separated values and drops blanks, so that both {@code -e a -e b} and {@code -e a,b} work.
     */
    static List<String> splitValues(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
