package com.morket.replication.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum BaseCode {

    // common
    STATUS_OK("STATUS_OK_200", HttpStatus.OK, "서버가 정상적으로 동작 중입니다."),
    INVALID_INPUT("INVALID_INPUT_400", HttpStatus.BAD_REQUEST, "잘못된 요청입니다."),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR_500", HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다."),

    // 복제 - 성공
    REPLICATION_STATS_SUCCESS("REPLICATION_STATS_SUCCESS_200", HttpStatus.OK, "복제 상태를 조회했습니다."),

    // 복제 - 예외
    UNKNOWN_CHANNEL("UNKNOWN_CHANNEL_500", HttpStatus.INTERNAL_SERVER_ERROR, "알 수 없는 복제 채널입니다."),
    SOURCE_FETCH_FAILED("SOURCE_FETCH_FAILED_500", HttpStatus.INTERNAL_SERVER_ERROR, "원본 데이터 조회에 실패했습니다."),
    ANALYTICAL_SINK_WRITE_FAILED("ANALYTICAL_SINK_WRITE_FAILED_500", HttpStatus.INTERNAL_SERVER_ERROR, "분석 저장소 적재에 실패했습니다."),
    NOTIFICATION_LISTEN_FAILED("NOTIFICATION_LISTEN_FAILED_500", HttpStatus.INTERNAL_SERVER_ERROR, "변경 알림 구독에 실패했습니다."),

    // DLQ - 성공
    DLQ_LIST_SUCCESS("DLQ_LIST_SUCCESS_200", HttpStatus.OK, "DLQ 목록을 조회했습니다."),
    DLQ_RESET_SUCCESS("DLQ_RESET_SUCCESS_200", HttpStatus.OK, "소진된 DLQ 이벤트를 재처리 대기로 되돌렸습니다."),

    // DLQ - 예외
    INVALID_DLQ_STATUS("INVALID_DLQ_STATUS_400", HttpStatus.BAD_REQUEST, "지원하지 않는 DLQ 상태입니다."),
    DLQ_PAYLOAD_SERIALIZATION_FAILED("DLQ_PAYLOAD_SERIALIZATION_FAILED_500", HttpStatus.INTERNAL_SERVER_ERROR, "DLQ 페이로드 변환에 실패했습니다.");

    private final String code;
    private final HttpStatus status;
    private final String message;
}
