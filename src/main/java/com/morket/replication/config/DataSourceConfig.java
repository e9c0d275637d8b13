package com.morket.replication.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 데이터소스 2개 구성
 * <p>
 * PostgreSQL (Primary) : 원본 조회, DLQ, ShedLock
 * ClickHouse : 분석 저장소 적재 전용
 */
@Configuration
public class DataSourceConfig {

    public static final String CLICKHOUSE_DATA_SOURCE = "clickHouseDataSource";

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties dataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties dataSourceProperties) {
        return dataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }

    @Bean
    @ConfigurationProperties("replication.clickhouse")
    public DataSourceProperties clickHouseDataSourceProperties() {
        return new DataSourceProperties();
    }

    // 커넥션은 첫 적재 시점에 생성 (ClickHouse 장애가 기동을 막지 않음)
    @Bean(name = CLICKHOUSE_DATA_SOURCE)
    @ConfigurationProperties("replication.clickhouse.hikari")
    public HikariDataSource clickHouseDataSource(
            @Qualifier("clickHouseDataSourceProperties") DataSourceProperties properties
    ) {
        return properties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }
}
