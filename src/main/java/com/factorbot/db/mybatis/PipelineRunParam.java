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
public class PipelineRunParam {
    private String runId;
    private LocalDate runDate;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private String status;
    private String frequency;
    private int backfillYears;
    private int companyLimit;
    private int rowsWritten;
    private String errorMessage;
    private String notes;
}
