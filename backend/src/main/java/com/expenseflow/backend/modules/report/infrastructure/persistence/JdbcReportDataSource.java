package com.expenseflow.backend.modules.report.infrastructure.persistence;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcReportDataSource implements ReportDataSource {

    private static final String COUNT_CONTENT_SQL = """
            select (select count(*) from mileage_entry where report_id = ?) as mileage_entries,
                   (select count(*) from receipt where report_id = ?) as receipts,
                   (select count(*) from time_entry where report_id = ?) as time_entries
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcReportDataSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public ReportContentCounts countContent(String reportId) {
        return jdbcTemplate.queryForObject(
                COUNT_CONTENT_SQL,
                (rs, rowNum) -> new ReportContentCounts(
                        rs.getLong("mileage_entries"),
                        rs.getLong("receipts"),
                        rs.getLong("time_entries")
                ),
                reportId,
                reportId,
                reportId
        );
    }
}
