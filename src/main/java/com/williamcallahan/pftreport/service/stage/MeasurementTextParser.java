package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.domain.report.DataQualityMetrics;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based recovery of spirometry values from decoded upload text.
 *
 * <p>Comma-separated uploads are read by column name first. Anything else, or a CSV whose columns
 * name no known parameter, is scanned line by line for labelled values such as {@code FVC: 3.5},
 * {@code "FEV1": 2.8} or {@code <DLCO>21</DLCO>}. Lines mentioning a post-bronchodilator
 * measurement feed the {@code post_bd_*} keys instead of the baseline ones.</p>
 */
final class MeasurementTextParser {

    /** Parameters counted towards data completeness. */
    static final List<String> CORE_PARAMETERS =
            List.of("fvc", "fev1", "fev1_fvc_ratio", "pef", "fef25_75", "tlc", "rv", "dlco");

    private static final List<String> POST_BRONCHODILATOR_PARAMETERS = List.of("fvc", "fev1");

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";
    private static final String SEPARATOR = "[\"']?\\s*[:=>]?\\s*[\"']?";
    private static final Pattern POST_BRONCHODILATOR_LINE =
            Pattern.compile("post[-_\\s]?(?:bd|bronchodilator)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RATIO_LABEL = Pattern.compile("FEV1\\s*/\\s*FVC", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PERCENT_PREDICTED = Pattern.compile(
            "^\\s*[A-Za-z/]*\\s*\\(?\\s*" + NUMBER + "\\s*%\\s*(?:of\\s+)?pred", Pattern.CASE_INSENSITIVE);

    // Longest labels first so FEV1/FVC is never read as FEV1.
    private static final Map<String, String> LABELS = orderedLabels();

    private static final Map<String, String> CSV_RATIO_ALIASES = Map.of(
            "fev1_fvc", "fev1_fvc_ratio",
            "fev1_fvc_ratio", "fev1_fvc_ratio",
            "fev1_fvc_percent", "fev1_fvc_ratio");

    private MeasurementTextParser() {}

    private static Map<String, String> orderedLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("fev1_fvc_ratio", "FEV1\\s*/\\s*FVC");
        labels.put("fef25_75", "FEF\\s*25\\s*[-–]\\s*75%?");
        labels.put("fev1", "FEV1");
        labels.put("fvc", "FVC");
        labels.put("pef", "PEF");
        labels.put("tlc", "TLC");
        labels.put("rv", "RV");
        labels.put("dlco", "DLCO");
        return labels;
    }

    /**
     * Parses decoded upload text.
     *
     * @param text decoded file content
     * @return extracted values, with an empty {@code rawData} when nothing was recognized
     */
    static ExtractedPftData parse(String text) {
        String content = text == null ? "" : text;
        return parseCsv(content).orElseGet(() -> parseLabelledText(content));
    }

    static Optional<ExtractedPftData> parseCsv(String content) {
        List<String> lines = content.lines().map(String::strip).filter(line -> !line.isEmpty()).toList();
        if (lines.size() < 2 || !lines.get(0).contains(",")) {
            return Optional.empty();
        }
        String[] headers = lines.get(0).split(",", -1);
        Values values = new Values();
        for (String row : lines.subList(1, lines.size())) {
            String[] cells = row.split(",", -1);
            for (int column = 0; column < headers.length && column < cells.length; column++) {
                Double value = parseNumber(cells[column]);
                if (value != null) {
                    values.putColumn(normalizeHeader(headers[column]), value);
                }
            }
        }
        if (values.raw.keySet().stream().noneMatch(CORE_PARAMETERS::contains)) {
            return Optional.empty();
        }
        return Optional.of(values.toExtractedData());
    }

    static ExtractedPftData parseLabelledText(String content) {
        Values values = new Values();
        for (String line : content.lines().toList()) {
            boolean postBronchodilator = POST_BRONCHODILATOR_LINE.matcher(line).find();
            String lineWithoutRatio = RATIO_LABEL.matcher(line).replaceAll("RATIO");
            for (Map.Entry<String, String> label : LABELS.entrySet()) {
                String parameter = label.getKey();
                String scanned = "fev1_fvc_ratio".equals(parameter) ? line : lineWithoutRatio;
                if (postBronchodilator) {
                    if (POST_BRONCHODILATOR_PARAMETERS.contains(parameter)) {
                        findLabelledValue(scanned, label.getValue())
                                .ifPresent(found -> values.raw.putIfAbsent("post_bd_" + parameter, found.value()));
                    }
                    continue;
                }
                findPercentPredicted(scanned, label.getValue())
                        .ifPresent(percent -> values.percent.putIfAbsent(parameter + "_percent", percent));
                findLabelledValue(scanned, label.getValue()).ifPresent(found -> {
                    values.putRaw(parameter, found.value());
                    Matcher trailing = TRAILING_PERCENT_PREDICTED.matcher(scanned.substring(found.end()));
                    if (trailing.find()) {
                        values.percent.putIfAbsent(parameter + "_percent", Double.parseDouble(trailing.group(1)));
                    }
                });
            }
        }
        return values.toExtractedData();
    }

    private static Optional<LabelledValue> findLabelledValue(String line, String labelPattern) {
        Matcher matcher = Pattern.compile(
                        "(?<![A-Za-z0-9/])" + labelPattern + "(?![A-Za-z0-9/])" + SEPARATOR + NUMBER,
                        Pattern.CASE_INSENSITIVE)
                .matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new LabelledValue(Double.parseDouble(matcher.group(1)), matcher.end()));
    }

    private static Optional<Double> findPercentPredicted(String line, String labelPattern) {
        Matcher matcher = Pattern.compile(
                        "(?<![A-Za-z0-9/])" + labelPattern + "\\s*(?:%\\s*pred(?:icted)?|percent\\s+predicted)"
                                + SEPARATOR + NUMBER,
                        Pattern.CASE_INSENSITIVE)
                .matcher(line);
        return matcher.find() ? Optional.of(Double.parseDouble(matcher.group(1))) : Optional.empty();
    }

    static String normalizeHeader(String header) {
        return header.strip().toLowerCase(Locale.ROOT)
                .replace("%", " percent ")
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }

    private static Double parseNumber(String cell) {
        String trimmed = cell.strip().replace("\"", "");
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException notNumeric) {
            return null;
        }
    }

    private record LabelledValue(double value, int end) {}

    private static final class Values {
        private final Map<String, Double> raw = new LinkedHashMap<>();
        private final Map<String, Double> predicted = new LinkedHashMap<>();
        private final Map<String, Double> percent = new LinkedHashMap<>();

        void putRaw(String parameter, double value) {
            // A ratio written as a fraction is stored as a percentage like every other ratio.
            double normalized = "fev1_fvc_ratio".equals(parameter) && value <= 1.0 ? value * 100 : value;
            raw.putIfAbsent(parameter, normalized);
        }

        void putColumn(String header, double value) {
            String ratioKey = CSV_RATIO_ALIASES.get(header);
            if (ratioKey != null) {
                // Later rows overwrite earlier ones so the last complete row wins.
                raw.remove(ratioKey);
                putRaw(ratioKey, value);
                return;
            }
            if (CORE_PARAMETERS.contains(header)) {
                raw.put(header, value);
                return;
            }
            for (String parameter : CORE_PARAMETERS) {
                if (header.equals("post_bd_" + parameter) || header.equals(parameter + "_post_bd")) {
                    raw.put("post_bd_" + parameter, value);
                    return;
                }
                if (header.equals(parameter + "_percent") || header.equals(parameter + "_pct")
                        || header.equals(parameter + "_percent_pred")
                        || header.equals(parameter + "_percent_predicted")) {
                    percent.put(parameter + "_percent", value);
                    return;
                }
                if (header.equals(parameter + "_pred") || header.equals(parameter + "_predicted")) {
                    predicted.put(parameter, value);
                    return;
                }
            }
        }

        ExtractedPftData toExtractedData() {
            List<String> missing = new ArrayList<>();
            for (String parameter : CORE_PARAMETERS) {
                if (!raw.containsKey(parameter)) {
                    missing.add(parameter);
                }
            }
            long found = CORE_PARAMETERS.size() - missing.size();
            double completeness = found * 100.0 / CORE_PARAMETERS.size();
            return new ExtractedPftData(raw, predicted, percent,
                    DataQualityMetrics.fromCompleteness(completeness, missing));
        }
    }
}
