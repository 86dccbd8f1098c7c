package com.govsense.pipeline.processing;

import com.govsense.pipeline.model.FieldType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Text to typed value conversion for each semantic type.
 *
 * Every failure surfaces as IllegalArgumentException so the cleaner can
 * treat all coercion problems alike.
 */
final class FieldParser {

    private static final Map<Pattern, DateTimeFormatter> DATE_FORMATS = Map.of(
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}"), DateTimeFormatter.ISO_LOCAL_DATE,
            Pattern.compile("\\d{2}/\\d{2}/\\d{4}"), DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            Pattern.compile("\\d{4}/\\d{2}/\\d{2}"), DateTimeFormatter.ofPattern("yyyy/MM/dd"));

    private static final Map<Pattern, DateTimeFormatter> MONTH_FORMATS = Map.of(
            Pattern.compile("\\d{4}-\\d{2}"), DateTimeFormatter.ofPattern("yyyy-MM"),
            Pattern.compile("\\d{6}"), DateTimeFormatter.ofPattern("yyyyMM"),
            Pattern.compile("\\d{2}/\\d{4}"), DateTimeFormatter.ofPattern("MM/yyyy"));

    private FieldParser() {
    }

    static Object parse(FieldType type, String text) {
        String value = text.trim();
        try {
            return switch (type) {
                case INTEGER -> new BigDecimal(normalizeNumber(value)).longValueExact();
                case DECIMAL -> parseDecimal(value);
                case TEXT -> value;
                case DATE -> parseDate(value);
                case MONTH -> parseMonth(value);
                case CODE -> parseCode(value);
            };
        } catch (ArithmeticException | DateTimeParseException e) {
            throw new IllegalArgumentException("Not a valid " + type + ": '" + value + "'", e);
        }
    }

    static Object zero(FieldType type) {
        return switch (type) {
            case INTEGER -> 0L;
            case DECIMAL -> 0.0d;
            default -> null;
        };
    }

    /**
     * French exports use spaces for grouping and a comma as decimal mark:
     * "1 234,56" → "1234.56". With both marks present the comma is grouping.
     */
    static String normalizeNumber(String value) {
        String compact = value.replace(" ", "")
                .replace("\u00A0", "")
                .replace("\u202F", "");
        if (compact.contains(",") && compact.contains(".")) {
            return compact.replace(",", "");
        }
        return compact.replace(',', '.');
    }

    private static Double parseDecimal(String value) {
        double d = Double.parseDouble(normalizeNumber(value));
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("Not a finite DECIMAL: '" + value + "'");
        }
        return d;
    }

    private static LocalDate parseDate(String value) {
        return LocalDate.parse(value, layoutOf(DATE_FORMATS, value, FieldType.DATE));
    }

    /** Any recognised layout, full dates included, collapses to YYYY-MM */
    private static String parseMonth(String value) {
        for (Map.Entry<Pattern, DateTimeFormatter> layout : MONTH_FORMATS.entrySet()) {
            if (layout.getKey().matcher(value).matches()) {
                return YearMonth.parse(value, layout.getValue()).toString();
            }
        }
        return YearMonth.from(parseDate(value)).toString();
    }

    private static DateTimeFormatter layoutOf(Map<Pattern, DateTimeFormatter> layouts, String value, FieldType type) {
        return layouts.entrySet().stream()
                .filter(layout -> layout.getKey().matcher(value).matches())
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Not a valid " + type + ": '" + value + "'"));
    }

    private static String parseCode(String value) {
        String code = value.toUpperCase(Locale.ROOT);
        if (code.isEmpty() || !code.matches("[0-9A-Z]+")) {
            throw new IllegalArgumentException("Not a valid CODE: '" + value + "'");
        }
        return code.replaceFirst("^0+(?=.)", "");
    }
}
