package com.leadintel.enricher.store;

import com.leadintel.enricher.model.CostEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only ledger of billable calls. Rows are never updated or deleted.
 */
@Repository
@RequiredArgsConstructor
public class CostLedgerRepository {

    private final JdbcTemplate jdbcTemplate;

    public record Totals(long requests, BigDecimal cost) {}

    public CostEvent append(CostEvent event) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO cost_events (provider, endpoint, cost, event_time, success, error_message)
                VALUES (?,?,?,?,?,?)
                """, Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, event.provider());
            ps.setString(2, event.endpoint());
            ps.setBigDecimal(3, event.cost());
            ps.setTimestamp(4, Timestamp.from(event.timestamp()));
            ps.setBoolean(5, event.success());
            ps.setString(6, event.errorMessage());
            return ps;
        }, keys);
        Number id = keys.getKey();
        return new CostEvent(id == null ? null : id.longValue(), event.provider(), event.endpoint(),
                event.cost(), event.timestamp(), event.success(), event.errorMessage());
    }

    /**
     * Request count and cost at or after {@code since}. A null provider sums every provider.
     */
    public Totals totalsSince(String provider, Instant since) {
        String sql = "SELECT COUNT(*) AS requests, COALESCE(SUM(cost), 0) AS total FROM cost_events WHERE event_time >= ?"
                + (provider == null ? "" : " AND provider = ?");
        Object[] args = provider == null
                ? new Object[]{Timestamp.from(since)}
                : new Object[]{Timestamp.from(since), provider};
        return jdbcTemplate.queryForObject(sql,
                (rs, i) -> new Totals(rs.getLong("requests"), rs.getBigDecimal("total")), args);
    }

    public List<CostEvent> findSince(Instant since) {
        return jdbcTemplate.query(
                "SELECT * FROM cost_events WHERE event_time >= ? ORDER BY event_time, id",
                eventMapper(), Timestamp.from(since));
    }

    /**
     * Per-provider call count, total and average cost since {@code since}, plus a "summary" entry.
     */
    public Map<String, Map<String, Object>> summaryByProvider(Instant since) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        long totalCalls = 0;
        BigDecimal totalCost = BigDecimal.ZERO;

        List<Map<String, Object>> rows = jdbcTemplate.queryForList("""
            SELECT provider, COUNT(*) AS call_count, SUM(cost) AS total_cost, AVG(cost) AS avg_cost
            FROM cost_events
            WHERE event_time >= ?
            GROUP BY provider
            ORDER BY provider
            """, Timestamp.from(since));

        for (Map<String, Object> row : rows) {
            long calls = ((Number) row.get("call_count")).longValue();
            BigDecimal cost = (BigDecimal) row.get("total_cost");
            result.put((String) row.get("provider"), Map.of(
                    "call_count", calls,
                    "total_cost", cost,
                    "avg_cost", row.get("avg_cost")));
            totalCalls += calls;
            totalCost = totalCost.add(cost);
        }

        result.put("summary", Map.of("total_calls", totalCalls, "total_cost", totalCost));
        return result;
    }

    private RowMapper<CostEvent> eventMapper() {
        return (rs, i) -> new CostEvent(
                rs.getLong("id"),
                rs.getString("provider"),
                rs.getString("endpoint"),
                rs.getBigDecimal("cost"),
                rs.getTimestamp("event_time").toInstant(),
                rs.getBoolean("success"),
                rs.getString("error_message"));
    }
}
