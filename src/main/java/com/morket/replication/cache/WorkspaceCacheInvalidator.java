package com.morket.replication.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 적재된 행의 workspace_id 별 캐시 무효화
 * 무효화 실패는 로그만 남기고 적재 결과에 영향 주지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkspaceCacheInvalidator {

    static final String WORKSPACE_ID_COLUMN = "workspace_id";

    private final ResultCache resultCache;

    public void invalidate(List<Map<String, Object>> rows) {
        for (String workspaceId : collectWorkspaceIds(rows)) {
            try {
                resultCache.invalidateWorkspace(workspaceId);
            } catch (Exception e) {
                log.warn("[Cache] 워크스페이스 캐시 무효화 실패. workspaceId: {}, error: {}",
                        workspaceId, e.getMessage());
            }
        }
    }

    static Set<String> collectWorkspaceIds(List<Map<String, Object>> rows) {
        Set<String> workspaceIds = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get(WORKSPACE_ID_COLUMN);
            if (value != null && !String.valueOf(value).isBlank()) {
                workspaceIds.add(String.valueOf(value));
            }
        }
        return workspaceIds;
    }
}
