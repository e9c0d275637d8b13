package com.morket.replication.common.notification;

import com.morket.replication.common.notification.dto.SlackMessage;
import com.morket.replication.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Slack 운영 알림 전송
 * <p>
 * 알림 전용 Executor 에서 비동기 실행
 * RestClientException 발생 시 최대 3회, 1초 간격 재시도
 * 최종 실패 시 @Recover 에서 로그만 남김
 */
@Slf4j
@Component
public class SlackNotifier {

    private final RestClient restClient;

    public SlackNotifier(
            RestClient.Builder restClientBuilder,
            @Value("${slack.webhook.url}") String webhookUrl
    ) {
        this.restClient = restClientBuilder
                .baseUrl(webhookUrl)
                .build();
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR_NAME)
    @Retryable(
            retryFor = {RestClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000)
    )
    public void sendAsync(SlackMessage message) {
        restClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .toBodilessEntity();

        log.info("[Slack] 메시지 전송 완료");
    }

    // 알림 실패는 복제 정합성에 영향 없음
    @Recover
    public void recover(RestClientException e, SlackMessage message) {
        log.error("[Slack] 메시지 전송 3회 재시도 후 최종 실패. error: {}, message: {}",
                e.getMessage(), message.text());
    }
}
