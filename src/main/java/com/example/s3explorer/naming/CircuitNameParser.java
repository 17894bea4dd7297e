package com.example.s3explorer.naming;

import java.time.DateTimeException;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses circuit file and folder names. Never throws: names outside the grammar are split on dashes
 * on a best-effort basis and typed {@value CircuitName#OTHER}.
 */
public final class CircuitNameParser {
    private static final Pattern CIRCUIT_NAME = Pattern.compile(
            "^(\\d{6})-(\\d+)-([A-Z])-([A-Z]+)-(R-[A-Z0-9]+)-(\\d+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_MONTH = Pattern.compile("^\\d{6}$");
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    private CircuitNameParser() {
    }

    public static CircuitName parse(String name) {
        String candidate = name == null ? "" : name.trim();
        Matcher matcher = CIRCUIT_NAME.matcher(candidate);
        if (matcher.matches()) {
            return new CircuitName(
                    matcher.group(1),
                    matcher.group(2),
                    matcher.group(3),
                    matcher.group(4),
                    matcher.group(5).toUpperCase(Locale.ROOT),
                    matcher.group(6)
            );
        }
        String[] parts = candidate.split("-", -1);
        return new CircuitName(
                YEAR_MONTH.matcher(part(parts, 0)).matches() ? part(parts, 0) : "",
                part(parts, 1),
                part(parts, 2),
                part(parts, 3),
                CircuitName.OTHER,
                part(parts, 5)
        );
    }

    /**
     * {@code 202505} becomes {@code May 2025}; anything that is not a valid year and month is
     * returned unchanged.
     */
    public static String formatYearMonth(String yearMonth) {
        if (yearMonth == null || !YEAR_MONTH.matcher(yearMonth).matches()) {
            return yearMonth == null ? "" : yearMonth;
        }
        try {
            YearMonth parsed = YearMonth.of(
                    Integer.parseInt(yearMonth.substring(0, 4)),
                    Integer.parseInt(yearMonth.substring(4, 6)));
            return MONTH_LABEL.format(parsed);
        } catch (DateTimeException ex) {
            return yearMonth;
        }
    }

    private static String part(String[] parts, int index) {
        return index < parts.length ? parts[index] : "";
    }
}
