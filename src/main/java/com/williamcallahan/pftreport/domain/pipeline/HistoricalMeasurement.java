package com.williamcallahan.pftreport.domain.pipeline;

import java.time.LocalDate;

/**
 * Prior spirometry result used to assess decline over time.
 *
 * @param testDate date of the historical test
 * @param fvc forced vital capacity in litres, or null
 * @param fev1 forced expiratory volume in one second in litres, or null
 * @param dlco diffusing capacity in mL/min/mmHg, or null
 */
public record HistoricalMeasurement(LocalDate testDate, Double fvc, Double fev1, Double dlco) {}
