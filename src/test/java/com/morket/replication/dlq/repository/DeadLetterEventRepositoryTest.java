package com.morket.replication.dlq.repository;

import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.entity.DeadLetterStatus;
import com.morket.replication.dlq.fixture.DeadLetterEventFixture;
import com.morket.replication.support.RepositoryTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DeadLetterEventRepository 테스트
 * <p>
 * - 재처리 대상 조회 (PENDING + next_retry_at 경과, 오래된 순)
 * - 조건부 상태 전이 (PENDING 에서만)
 * - 소진 이벤트 리셋
 */
class DeadLetterEventRepositoryTest extends RepositoryTestSupport {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 12, 0);

    @Autowired
    private DeadLetterEventRepository deadLetterEventRepository;

    @Autowired
    private TestEntityManager em;

    private DeadLetterEvent persist(DeadLetterEvent event) {
        DeadLetterEvent saved = deadLetterEventRepository.save(event);
        em.flush();
        return saved;
    }

    // 감사 필드는 저장 시점 값으로 채워지므로 정렬 검증용으로 직접 덮어씀
    private void overwriteCreatedAt(Long id, LocalDateTime createdAt) {
        em.getEntityManager()
                .createNativeQuery("UPDATE dead_letter_queue SET created_at = ?1 WHERE id = ?2")
                .setParameter(1, createdAt)
                .setParameter(2, id)
                .executeUpdate();
    }

    private DeadLetterEvent reload(Long id) {
        em.clear();
        return deadLetterEventRepository.findById(id).orElseThrow();
    }

    @Nested
    @DisplayName("findPending")
    class FindPendingTest {

        @Test
        @DisplayName("PENDING 이면서 next_retry_at 이 지난 행만, 오래된 순")
        void findPending_FiltersAndOrders() {
            // given
            DeadLetterEvent newer = persist(DeadLetterEventFixture.pending("rec-newer", NOW.minusMinutes(1)));
            DeadLetterEvent older = persist(DeadLetterEventFixture.pending("rec-older", NOW.minusMinutes(1)));
            DeadLetterEvent notDue = persist(DeadLetterEventFixture.pending("rec-future", NOW.plusMinutes(5)));
            DeadLetterEvent exhausted = persist(DeadLetterEventFixture.builder()
                    .recordId("rec-exhausted")
                    .status(DeadLetterStatus.EXHAUSTED)
                    .nextRetryAt(NOW.minusMinutes(1))
                    .build());

            overwriteCreatedAt(newer.getId(), NOW.minusMinutes(10));
            overwriteCreatedAt(older.getId(), NOW.minusMinutes(30));
            em.clear();

            // when
            List<DeadLetterEvent> pending = deadLetterEventRepository.findPending(NOW, PageRequest.of(0, 50));

            // then
            assertThat(pending).extracting(DeadLetterEvent::getId)
                    .containsExactly(older.getId(), newer.getId())
                    .doesNotContain(notDue.getId(), exhausted.getId());
        }

        @Test
        @DisplayName("next_retry_at 이 현재와 같으면 대상")
        void findPending_InclusiveBoundary() {
            // given
            DeadLetterEvent due = persist(DeadLetterEventFixture.pending("rec-1", NOW));

            // when
            List<DeadLetterEvent> pending = deadLetterEventRepository.findPending(NOW, PageRequest.of(0, 50));

            // then
            assertThat(pending).extracting(DeadLetterEvent::getId).containsExactly(due.getId());
        }

        @Test
        @DisplayName("limit 적용")
        void findPending_Limit() {
            // given
            for (int i = 0; i < 5; i++) {
                persist(DeadLetterEventFixture.pending("rec-" + i, NOW.minusMinutes(1)));
            }

            // when
            List<DeadLetterEvent> pending = deadLetterEventRepository.findPending(NOW, PageRequest.of(0, 3));

            // then
            assertThat(pending).hasSize(3);
        }
    }

    @Nested
    @DisplayName("조건부 상태 전이")
    class TransitionTest {

        @Test
        @DisplayName("markReplayed : PENDING -> REPLAYED")
        void markReplayed_FromPending() {
            // given
            DeadLetterEvent event = persist(DeadLetterEventFixture.pending("rec-1", NOW));

            // when
            int updated = deadLetterEventRepository.markReplayed(event.getId(), NOW);

            // then
            assertThat(updated).isEqualTo(1);
            assertThat(reload(event.getId()).getStatus()).isEqualTo(DeadLetterStatus.REPLAYED);
        }

        @Test
        @DisplayName("markReplayed : 이미 종료된 행은 0건 (경쟁 상태 방지)")
        void markReplayed_AlreadyTerminal() {
            // given
            DeadLetterEvent event = persist(DeadLetterEventFixture.builder()
                    .status(DeadLetterStatus.EXHAUSTED)
                    .build());

            // when
            int updated = deadLetterEventRepository.markReplayed(event.getId(), NOW);

            // then
            assertThat(updated).isZero();
            assertThat(reload(event.getId()).getStatus()).isEqualTo(DeadLetterStatus.EXHAUSTED);
        }

        @Test
        @DisplayName("markExhausted : 마지막 실패도 retryCount 에 포함, 오류 사유는 마지막 실패로 갱신")
        void markExhausted_IncrementsRetryCount() {
            // given
            DeadLetterEvent event = persist(DeadLetterEventFixture.builder()
                    .retryCount(4)
                    .maxRetries(5)
                    .build());

            // when
            int updated = deadLetterEventRepository.markExhausted(event.getId(), "replay timeout", NOW);

            // then
            DeadLetterEvent result = reload(event.getId());
            assertThat(updated).isEqualTo(1);
            assertThat(result.getStatus()).isEqualTo(DeadLetterStatus.EXHAUSTED);
            assertThat(result.getRetryCount()).isEqualTo(5);
            assertThat(result.getRetryCount()).isGreaterThanOrEqualTo(result.getMaxRetries());
            assertThat(result.getErrorReason()).isEqualTo("replay timeout");
        }

        @Test
        @DisplayName("incrementRetry : retryCount + 1, next_retry_at 과 오류 사유 갱신, PENDING 유지")
        void incrementRetry_AdvancesSchedule() {
            // given
            DeadLetterEvent event = persist(DeadLetterEventFixture.pending("rec-1", NOW));
            LocalDateTime next = NOW.plusMinutes(2);

            // when
            int updated = deadLetterEventRepository.incrementRetry(event.getId(), next, "replay timeout", NOW);

            // then
            DeadLetterEvent result = reload(event.getId());
            assertThat(updated).isEqualTo(1);
            assertThat(result.getStatus()).isEqualTo(DeadLetterStatus.PENDING);
            assertThat(result.getRetryCount()).isEqualTo(1);
            assertThat(result.getNextRetryAt()).isEqualTo(next);
            assertThat(result.getErrorReason()).isEqualTo("replay timeout");
        }

        @Test
        @DisplayName("resetExhausted : EXHAUSTED 만 PENDING, retryCount 0, 즉시 대상")
        void resetExhausted_OnlyExhausted() {
            // given
            DeadLetterEvent exhausted = persist(DeadLetterEventFixture.builder()
                    .retryCount(5)
                    .status(DeadLetterStatus.EXHAUSTED)
                    .nextRetryAt(NOW.minusDays(1))
                    .build());
            DeadLetterEvent replayed = persist(DeadLetterEventFixture.builder()
                    .status(DeadLetterStatus.REPLAYED)
                    .build());

            // when
            int reset = deadLetterEventRepository.resetExhausted(NOW);

            // then
            assertThat(reset).isEqualTo(1);

            DeadLetterEvent result = reload(exhausted.getId());
            assertThat(result.getStatus()).isEqualTo(DeadLetterStatus.PENDING);
            assertThat(result.getRetryCount()).isZero();
            assertThat(result.getNextRetryAt()).isEqualTo(NOW);
            assertThat(reload(replayed.getId()).getStatus()).isEqualTo(DeadLetterStatus.REPLAYED);
        }
    }

    @Test
    @DisplayName("findByStatus / countByStatus : 상태별 조회, 최신순 페이지")
    void findByStatus_NewestFirst() {
        // given
        DeadLetterEvent first = persist(DeadLetterEventFixture.builder().status(DeadLetterStatus.EXHAUSTED).build());
        DeadLetterEvent second = persist(DeadLetterEventFixture.builder().status(DeadLetterStatus.EXHAUSTED).build());
        persist(DeadLetterEventFixture.builder().status(DeadLetterStatus.PENDING).build());

        overwriteCreatedAt(first.getId(), NOW.minusHours(2));
        overwriteCreatedAt(second.getId(), NOW.minusHours(1));
        em.clear();

        // when
        Page<DeadLetterEvent> page = deadLetterEventRepository.findByStatus(
                DeadLetterStatus.EXHAUSTED,
                PageRequest.of(0, 10, Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")))
        );

        // then
        assertThat(page.getTotalElements()).isEqualTo(2);
        assertThat(page.getContent()).extracting(DeadLetterEvent::getId)
                .containsExactly(second.getId(), first.getId());
        assertThat(deadLetterEventRepository.countByStatus(DeadLetterStatus.PENDING)).isEqualTo(1);
    }
}
