package com.morket.replication.source;

import com.morket.replication.channel.ReplicationChannel;

import java.util.List;
import java.util.Map;

/**
 * 원본(트랜잭션) 저장소 조회
 */
public interface SourceStoreAdapter {

    /**
     * 식별자 목록에 해당하는 비정규화 행 조회
     * 존재하지 않는 식별자는 결과에서 빠지며, 반환 순서는 보장하지 않음
     *
     * @param channel 복제 채널
     * @param ids     중복 제거된 원본 행 식별자
     * @return 분석 저장소 컬럼명을 키로 하는 행 목록
     */
    List<Map<String, Object>> fetchDenormalizedRows(ReplicationChannel channel, List<String> ids);
}
