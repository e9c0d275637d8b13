package com.morket.replication.support;

import com.morket.replication.config.JpaConfig;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Repository 슬라이스 테스트 추상 부모 클래스
 * JPA 관련 빈만 로드, application-test.yml 의 H2 (PostgreSQL 호환 모드) 에 스키마 자동 생성
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaConfig.class)
public abstract class RepositoryTestSupport {
}
