package com.williamcallahan.pftreport.domain.pipeline;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Uploaded diagnostic artifact plus the structured metadata it was submitted with.
 *
 * @param fileName original file name as supplied by the client
 * @param content raw file bytes
 * @param demographics subject attributes
 * @param historicalData prior measurements, possibly empty
 * @param priority requested processing priority
 * @param requestingPhysician optional referring physician
 */
public record SubmissionInput(
        String fileName,
        byte[] content,
        SubjectDemographics demographics,
        List<HistoricalMeasurement> historicalData,
        TriagePriority priority,
        String requestingPhysician) {

    public SubmissionInput {
        content = content == null ? new byte[0] : content.clone();
        historicalData = historicalData == null ? List.of() : List.copyOf(historicalData);
        priority = priority == null ? TriagePriority.ROUTINE : priority;
    }

    /**
     * Lower-cased extension of the file name without the dot, or an empty string when absent.
     */
    public String fileType() {
        if (fileName == null) {
            return "";
        }
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int contentLength() {
        return content.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SubmissionInput that)) {
            return false;
        }
        return Objects.equals(fileName, that.fileName)
                && Arrays.equals(content, that.content)
                && Objects.equals(demographics, that.demographics)
                && Objects.equals(historicalData, that.historicalData)
                && priority == that.priority
                && Objects.equals(requestingPhysician, that.requestingPhysician);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(fileName, demographics, historicalData, priority, requestingPhysician);
        return 31 * result + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SubmissionInput[fileName=" + fileName + ", bytes=" + content.length
                + ", subjectId=" + (demographics == null ? null : demographics.subjectId())
                + ", priority=" + priority + "]";
    }
}
