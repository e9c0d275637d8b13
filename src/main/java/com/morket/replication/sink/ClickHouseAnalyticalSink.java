package com.morket.replication.sink;

import com.morket.replication.config.DataSourceConfig;
import com.morket.replication.sink.exception.AnalyticalSinkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * ClickHouse 배치 적재
 * <p>
 * 행들의 컬럼 합집합(이름순)으로 INSERT 문 하나를 만들고 batchUpdate 로 전송
 * 행에 없는 컬럼은 NULL 로 채움 (ClickHouse 기본값 적용)
 */
@Slf4j
@Component
public class ClickHouseAnalyticalSink implements AnalyticalSink {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;

    @Autowired
    public ClickHouseAnalyticalSink(@Qualifier(DataSourceConfig.CLICKHOUSE_DATA_SOURCE) DataSource dataSource) {
        this(new JdbcTemplate(dataSource));
    }

    ClickHouseAnalyticalSink(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(String table, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return;
        }

        List<String> columns = collectColumns(rows);
        String sql = buildInsertSql(table, columns);

        List<Object[]> batchArgs = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object[] args = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                args[i] = row.get(columns.get(i));
            }
            batchArgs.add(args);
        }

        try {
            jdbcTemplate.batchUpdate(sql, batchArgs);
            log.debug("[ClickHouse] 적재 완료. table: {}, rows: {}", table, rows.size());

        } catch (DataAccessException e) {
            throw new AnalyticalSinkException(table, rows.size(), e);
        }
    }

    static List<String> collectColumns(List<Map<String, Object>> rows) {
        SortedSet<String> columns = new TreeSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }

    static String buildInsertSql(String table, List<String> columns) {
        requireIdentifier(table);
        columns.forEach(ClickHouseAnalyticalSink::requireIdentifier);

        String placeholders = String.join(", ", columns.stream().map(column -> "?").toList());
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
    }

    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("허용되지 않는 식별자: " + name);
        }
    }
}
