package com.williamcallahan.pftreport.service.stage;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Number and label formatting shared by the rule-based findings and narrative templates.
 */
final class ReportFormatting {

    private ReportFormatting() {}

    /**
     * Formats a measurement without trailing zeros, e.g. {@code 65.0 -> "65"} and {@code 2.50 -> "2.5"}.
     */
    static String number(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        return rounded.scale() < 0 ? rounded.setScale(0).toPlainString() : rounded.toPlainString();
    }

    static String numberOr(Double value, String placeholder) {
        return value == null ? placeholder : number(value);
    }

    /**
     * Turns a wire value such as {@code very_severe} into {@code Very Severe}.
     */
    static String titleCase(String wireValue) {
        StringBuilder title = new StringBuilder();
        for (String word : wireValue.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return title.toString();
    }

    static String words(String wireValue) {
        return wireValue.replace('_', ' ');
    }
}
