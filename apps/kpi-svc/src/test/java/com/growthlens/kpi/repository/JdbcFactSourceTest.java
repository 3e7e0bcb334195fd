package com.growthlens.kpi.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.growthlens.kpi.config.KpiProperties;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

@ExtendWith(MockitoExtension.class)
class JdbcFactSourceTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Test
    void queriesConfiguredTableForOneDay() {
        KpiProperties properties = new KpiProperties(null, null, null, null, null,
                new KpiProperties.Facts("ods.newuser_daily"), null);
        List<Map<String, Object>> rows = List.of(Map.of("dt", "2024-05-08"));
        when(jdbcTemplate.queryForList(anyString(), any(SqlParameterSource.class))).thenReturn(rows);

        List<Map<String, Object>> result = new JdbcFactSource(jdbcTemplate, properties).fetchFacts(LocalDate.of(2024, 5, 8));

        assertThat(result).isSameAs(rows);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).queryForList(sql.capture(), params.capture());
        assertThat(sql.getValue()).contains("FROM ods.newuser_daily").contains("dt = :dt");
        assertThat(((MapSqlParameterSource) params.getValue()).getValue("dt"))
                .isEqualTo(java.sql.Date.valueOf(LocalDate.of(2024, 5, 8)));
    }
}
