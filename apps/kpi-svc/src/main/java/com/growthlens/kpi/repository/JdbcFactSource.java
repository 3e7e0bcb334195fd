package com.growthlens.kpi.repository;

import com.growthlens.kpi.config.KpiProperties;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads one day of the upstream fact table. Column names are returned as stored; the
 * normalizer maps them.
 */
@Repository
public class JdbcFactSource implements FactSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcFactSource.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String table;

    public JdbcFactSource(NamedParameterJdbcTemplate jdbcTemplate, KpiProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = properties.facts().table();
    }

    @Override
    public List<Map<String, Object>> fetchFacts(LocalDate date) {
        // table name is validated as a plain identifier in KpiProperties
        String sql = "SELECT * FROM " + table + " WHERE dt = :dt";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("dt", java.sql.Date.valueOf(date));
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
        log.debug("Fetched {} fact rows from {} for {}", rows.size(), table, date);
        return rows;
    }
}
