package com.musicinsights.listeningstats.application.aggregate.query;

import com.musicinsights.listeningstats.application.aggregate.dimension.Dimension;

import java.util.List;

/**
 * 실행 준비가 끝난 집계 쿼리.
 *
 * @param dimensions        결과 앞쪽 컬럼에 대응하는 차원(요청 순서)
 * @param statementText     ? 플레이스홀더를 포함한 SQL
 * @param orderedBindValues 바인딩 값(필터 값들 → limit 순)
 */
public record QueryPlan(
        List<Dimension> dimensions,
        String statementText,
        List<Object> orderedBindValues
) {
    public QueryPlan {
        dimensions = List.copyOf(dimensions);
        orderedBindValues = List.copyOf(orderedBindValues);
    }
}
