package com.musicinsights.listeningstats.application.aggregate.dto.response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 집계 결과 1행.
 *
 * @param dimensions   요청한 차원 컬럼명 → 값 (요청 순서 유지)
 * @param totalMinutes 재생 시간 합(분)
 * @param playCount    재생 수
 */
public record AggregateRow(
        Map<String, Object> dimensions,
        double totalMinutes,
        long playCount
) {
    public static final String TOTAL_MINUTES = "total_minutes";
    public static final String PLAY_COUNT = "play_count";

    public AggregateRow {
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    /**
     * 응답 JSON 용 평탄화 맵. 차원 값 뒤에 total_minutes, play_count 가 붙는다.
     *
     * @return {dimension: value, ..., total_minutes, play_count}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(dimensions);
        map.put(TOTAL_MINUTES, totalMinutes);
        map.put(PLAY_COUNT, playCount);
        return map;
    }
}
