package com.factorbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinancialObservationRow {
    private String symbol;
    private LocalDate reportDate;
    private String metricName;
    private Double metricValue;
    private String periodType;
    private String source;
    private LocalDate asOf;
}
