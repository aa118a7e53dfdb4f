package com.musicinsights.listeningstats.application.aggregate.dto.response;

import java.util.List;
import java.util.Map;

/**
 * 집계 API 응답 DTO.
 *
 * @param data 집계 행 목록(재생 시간 DESC)
 */
public record AggregateResponse(
        List<Map<String, Object>> data
) {
    public static AggregateResponse of(List<AggregateRow> rows) {
        return new AggregateResponse(rows.stream().map(AggregateRow::toMap).toList());
    }
}
