package com.williamcallahan.pftreport.domain.pipeline;

/**
 * Subject identifiers and classifying attributes supplied with a submission.
 *
 * <p>Structural validation happens at admission time, not here, so a malformed instance can be
 * reported back to the caller with every offending field instead of failing on the first.</p>
 *
 * @param subjectId unique subject identifier
 * @param age age in years
 * @param gender reported gender (M/F/Other)
 * @param heightCm height in centimetres
 * @param weightKg weight in kilograms
 * @param ethnicity optional ethnicity, used for reference-equation selection
 * @param smokingStatus optional Current/Former/Never smoker
 */
public record SubjectDemographics(
        String subjectId,
        int age,
        String gender,
        double heightCm,
        double weightKg,
        String ethnicity,
        String smokingStatus) {}
