package com.factorbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRow {
    private String runId;
    private LocalDate runDate;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private String status;
    private String frequency;
    private Integer backfillYears;
    private Integer companyLimit;
    private Integer rowsWritten;
    private String errorMessage;
    private String notes;
}
