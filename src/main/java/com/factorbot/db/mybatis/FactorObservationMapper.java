package com.factorbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface FactorObservationMapper {
    @Insert("INSERT INTO factor_observations(symbol, observation_date, factor_name, factor_value, source, " +
            "metric_frequency, source_report_date, quality_flags, run_id, updated_at) " +
            "VALUES(#{symbol}, #{observationDate}, #{factorName}, #{factorValue}, #{source}, " +
            "#{metricFrequency}, #{sourceReportDate}, #{qualityFlags}, #{runId}, #{updatedAt}) " +
            "ON CONFLICT(symbol, observation_date, factor_name) DO UPDATE SET " +
            "factor_value=excluded.factor_value, source=excluded.source, metric_frequency=excluded.metric_frequency, " +
            "source_report_date=excluded.source_report_date, quality_flags=excluded.quality_flags, " +
            "run_id=excluded.run_id, updated_at=excluded.updated_at")
    int upsertFactor(FactorObservationParam row);

    @Select({
            "<script>",
            "SELECT symbol, observation_date, factor_name, factor_value, source, metric_frequency, source_report_date, quality_flags ",
            "FROM factor_observations ",
            "WHERE observation_date &gt;= #{from} AND observation_date &lt;= #{to} ",
            "AND factor_name IN ",
            "<foreach collection='metricNames' item='name' open='(' separator=',' close=')'>",
            "#{name}",
            "</foreach>",
            "<if test='symbols != null and symbols.size() &gt; 0'>",
            "AND symbol IN ",
            "<foreach collection='symbols' item='symbol' open='(' separator=',' close=')'>",
            "#{symbol}",
            "</foreach>",
            "</if>",
            "ORDER BY symbol, observation_date",
            "</script>"
    })
    List<FactorObservationRow> selectRange(
            @Param("symbols") List<String> symbols,
            @Param("metricNames") List<String> metricNames,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );
}
