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
public class FinancialObservationParam {
    private String symbol;
    private LocalDate reportDate;
    private String metricName;
    private Double metricValue;
    private String currency;
    private String periodType;
    private String metricDefinition;
    private String source;
    private LocalDate asOf;
    private OffsetDateTime updatedAt;
}
