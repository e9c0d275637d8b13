package com.morket.replication.cache;

/**
 * 분석 조회 결과 캐시
 */
public interface ResultCache {

    /**
     * 워크스페이스의 모든 분석 결과 무효화
     *
     * @param workspaceId 워크스페이스 ID
     * @return 제거된 항목 수
     */
    int invalidateWorkspace(String workspaceId);
}
