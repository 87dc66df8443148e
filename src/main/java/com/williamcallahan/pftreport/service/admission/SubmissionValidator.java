package com.williamcallahan.pftreport.service.admission;

import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.SubjectDemographics;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Structural checks applied before a submission is admitted.
 */
@Component
public class SubmissionValidator {

    private static final int MIN_AGE = 0;
    private static final int MAX_AGE = 150;

    private final AppProperties.Admission admissionSettings;

    public SubmissionValidator(AppProperties appProperties) {
        this.admissionSettings = appProperties.getAdmission();
    }

    /**
     * Validates the submission, reporting every violation at once.
     *
     * @throws SubmissionValidationException when any check fails
     */
    public void validate(SubmissionInput input) {
        if (input == null) {
            throw new SubmissionValidationException(List.of("Submission is required"));
        }
        List<String> violations = new ArrayList<>();

        long maxBytes = admissionSettings.getMaxFileSize().toBytes();
        if (input.contentLength() == 0) {
            violations.add("File is empty");
        } else if (input.contentLength() > maxBytes) {
            violations.add("File size " + input.contentLength() + " bytes exceeds the maximum of " + maxBytes + " bytes");
        }
        String fileType = input.fileType();
        if (!admissionSettings.getSupportedFileTypes().contains(fileType)) {
            violations.add("Unsupported file type '" + fileType + "'; supported types: "
                    + String.join(", ", admissionSettings.getSupportedFileTypes()));
        }

        SubjectDemographics demographics = input.demographics();
        if (demographics == null) {
            violations.add("Subject demographics are required");
        } else {
            if (isBlank(demographics.subjectId())) {
                violations.add("Subject id is required");
            }
            if (isBlank(demographics.gender())) {
                violations.add("Gender is required");
            }
            if (demographics.age() < MIN_AGE || demographics.age() > MAX_AGE) {
                violations.add("Age must be between " + MIN_AGE + " and " + MAX_AGE);
            }
            if (!(demographics.heightCm() > 0)) {
                violations.add("Height must be greater than 0");
            }
            if (!(demographics.weightKg() > 0)) {
                violations.add("Weight must be greater than 0");
            }
        }

        if (!violations.isEmpty()) {
            throw new SubmissionValidationException(violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
