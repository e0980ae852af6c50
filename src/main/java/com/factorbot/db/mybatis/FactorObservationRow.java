package com.factorbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FactorObservationRow {
    private String symbol;
    private LocalDate observationDate;
    private String factorName;
    private Double factorValue;
    private String source;
    private String metricFrequency;
    private LocalDate sourceReportDate;
    private String qualityFlags;
}
