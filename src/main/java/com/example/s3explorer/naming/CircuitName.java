package com.example.s3explorer.naming;

/**
 * Fields of a name shaped like {@code YYYYMM-BATCH-LETTER-PROJECT-TYPE-SERIAL}, for example
 * {@code 202508-028-S-KHI-R-UW-00152}. Fields that could not be recovered are empty strings.
 */
public record CircuitName(
        String yearMonth,
        String batch,
        String letter,
        String project,
        String type,
        String serial
) {
    public static final String OTHER = "Other";

    public CircuitName {
        yearMonth = orEmpty(yearMonth);
        batch = orEmpty(batch);
        letter = orEmpty(letter);
        project = orEmpty(project);
        type = orEmpty(type);
        serial = orEmpty(serial);
    }

    public boolean isRecognized() {
        return !OTHER.equals(type);
    }

    /**
     * Grouping key for {@code dimension}; {@value #OTHER} when the field is empty.
     */
    public String groupKey(CircuitDimension dimension) {
        String value = switch (dimension) {
            case TYPE -> type;
            case YEAR_MONTH -> CircuitNameParser.formatYearMonth(yearMonth);
            case PROJECT -> project;
            case BATCH -> batch;
        };
        return value.isEmpty() ? OTHER : value;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
