package com.morket.replication.source;

import com.morket.replication.channel.ReplicationChannel;
import com.morket.replication.source.exception.SourceFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL 원본 조회
 * 채널별 JOIN 쿼리로 ClickHouse 테이블 스키마에 맞춘 행을 만든다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcSourceStoreAdapter implements SourceStoreAdapter {

    // enrichment_records + enrichment_jobs
    static final String ENRICHMENT_EVENTS_SQL = """
            SELECT
              er.id AS event_id,
              er.workspace_id,
              er.job_id,
              er.id AS record_id,
              er.provider_slug,
              COALESCE(er.field_name, 'unknown') AS enrichment_field,
              er.status,
              COALESCE(er.credits_consumed, 0) AS credits_consumed,
              COALESCE(EXTRACT(EPOCH FROM (er.updated_at - er.created_at)) * 1000, 0)::integer AS duration_ms,
              er.error_reason AS error_category,
              er.created_at,
              ej.created_at AS job_created_at
            FROM enrichment_records er
            JOIN enrichment_jobs ej ON er.job_id = ej.id
            WHERE er.id::text IN (:ids)
            """;

    // scrape_tasks + scrape_jobs
    static final String SCRAPE_EVENTS_SQL = """
            SELECT
              st.id AS event_id,
              st.workspace_id,
              st.job_id,
              st.id AS task_id,
              COALESCE(st.target_domain, 'unknown') AS target_domain,
              COALESCE(st.target_type, 'unknown') AS target_type,
              st.status,
              COALESCE(EXTRACT(EPOCH FROM (st.updated_at - st.created_at)) * 1000, 0)::integer AS duration_ms,
              st.proxy_used,
              st.error_reason AS error_category,
              st.created_at,
              sj.created_at AS job_created_at
            FROM scrape_tasks st
            JOIN scrape_jobs sj ON st.job_id = sj.id
            WHERE st.id::text IN (:ids)
            """;

    // credit_transactions 단독
    static final String CREDIT_EVENTS_SQL = """
            SELECT
              ct.id AS event_id,
              ct.workspace_id,
              ct.transaction_type,
              ct.amount,
              COALESCE(ct.description, 'manual') AS source,
              ct.reference_id,
              NULL AS provider_slug,
              ct.created_at
            FROM credit_transactions ct
            WHERE ct.id::text IN (:ids)
            """;

    private static final Map<ReplicationChannel, String> QUERIES = new EnumMap<>(Map.of(
            ReplicationChannel.ENRICHMENT_EVENTS, ENRICHMENT_EVENTS_SQL,
            ReplicationChannel.SCRAPE_EVENTS, SCRAPE_EVENTS_SQL,
            ReplicationChannel.CREDIT_EVENTS, CREDIT_EVENTS_SQL
    ));

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public List<Map<String, Object>> fetchDenormalizedRows(ReplicationChannel channel, List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        MapSqlParameterSource params = new MapSqlParameterSource("ids", ids);

        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(QUERIES.get(channel), params);

            log.debug("[Source] 원본 조회 완료. channel: {}, 요청: {}, 조회: {}",
                    channel.getChannelName(), ids.size(), rows.size());
            return rows;

        } catch (DataAccessException e) {
            throw new SourceFetchException(channel, e);
        }
    }
}
