package com.flagship.pawnshop.report;

import com.flagship.pawnshop.exception.BusinessValidationException;

import java.util.Locale;

/**
 * Output format of the export endpoints. CSV when not specified.
 */
public enum ExportFormat {
    CSV,
    JSON;

    /**
     * @throws BusinessValidationException for anything other than csv or json
     */
    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return CSV;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "csv" -> CSV;
            case "json" -> JSON;
            default -> throw new BusinessValidationException("export_format",
                "Unsupported export format: " + value + ". Use csv or json");
        };
    }
}
