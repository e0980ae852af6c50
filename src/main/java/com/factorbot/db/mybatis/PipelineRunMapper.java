package com.factorbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

public interface PipelineRunMapper {
    @Insert("INSERT INTO pipeline_runs(run_id, run_date, started_at, status, frequency, backfill_years, company_limit, " +
            "rows_written, error_message, notes) " +
            "VALUES(#{runId}, #{runDate}, #{startedAt}, #{status}, #{frequency}, #{backfillYears}, #{companyLimit}, " +
            "#{rowsWritten}, #{errorMessage}, #{notes}) " +
            "ON CONFLICT(run_id) DO UPDATE SET status=excluded.status, started_at=excluded.started_at, notes=excluded.notes")
    int insertRun(PipelineRunParam run);

    @Update("UPDATE pipeline_runs SET finished_at=#{finishedAt}, status=#{status}, rows_written=#{rowsWritten}, " +
            "error_message=#{errorMessage}, notes=#{notes} WHERE run_id=#{runId}")
    int updateRunFinish(PipelineRunParam run);

    @Select("SELECT run_id, run_date, started_at, finished_at, status, frequency, backfill_years, company_limit, " +
            "rows_written, error_message, notes FROM pipeline_runs WHERE run_id=#{runId} LIMIT 1")
    PipelineRunRow findById(@Param("runId") String runId);
}
