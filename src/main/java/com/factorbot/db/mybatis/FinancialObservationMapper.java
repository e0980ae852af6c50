package com.factorbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface FinancialObservationMapper {
    @Insert("INSERT INTO financial_observations(symbol, report_date, metric_name, metric_value, currency, " +
            "period_type, metric_definition, source, as_of, updated_at) " +
            "VALUES(#{symbol}, #{reportDate}, #{metricName}, #{metricValue}, #{currency}, " +
            "#{periodType}, #{metricDefinition}, #{source}, #{asOf}, #{updatedAt}) " +
            "ON CONFLICT(symbol, report_date, metric_name) DO UPDATE SET " +
            "metric_value=excluded.metric_value, currency=excluded.currency, period_type=excluded.period_type, " +
            "metric_definition=excluded.metric_definition, source=excluded.source, as_of=excluded.as_of, " +
            "updated_at=excluded.updated_at")
    int upsertFinancial(FinancialObservationParam row);

    @Select({
            "<script>",
            "SELECT symbol, report_date, metric_name, metric_value, period_type, source, as_of ",
            "FROM financial_observations ",
            "WHERE report_date &gt;= #{from} AND report_date &lt;= #{to} ",
            "<if test='symbols != null and symbols.size() &gt; 0'>",
            "AND symbol IN ",
            "<foreach collection='symbols' item='symbol' open='(' separator=',' close=')'>",
            "#{symbol}",
            "</foreach>",
            "</if>",
            "ORDER BY symbol, report_date",
            "</script>"
    })
    List<FinancialObservationRow> selectRange(
            @Param("symbols") List<String> symbols,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );
}
