package com.factorbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactorObservationParam {
    private String symbol;
    private LocalDate observationDate;
    private String factorName;
    private Double factorValue;
    private String source;
    private String metricFrequency;
    private LocalDate sourceReportDate;
    private String qualityFlags;
    private String runId;
    private OffsetDateTime updatedAt;
}
