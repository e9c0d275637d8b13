package com.morket.replication.sink;

import com.morket.replication.sink.exception.AnalyticalSinkException;

import java.util.List;
import java.util.Map;

/**
 * 분석 저장소 적재
 */
public interface AnalyticalSink {

    /**
     * 행 목록을 한 번의 배치로 적재
     *
     * @param table 대상 테이블
     * @param rows  컬럼명을 키로 하는 행 목록
     * @throws AnalyticalSinkException 적재 실패
     */
    void insert(String table, List<Map<String, Object>> rows);
}
