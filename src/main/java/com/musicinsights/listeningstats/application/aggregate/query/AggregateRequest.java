package com.musicinsights.listeningstats.application.aggregate.query;

import java.util.List;

/**
 * 검증 전의 집계 요청.
 *
 * <p>groupBy 순서가 의미를 가진다(첫 번째가 primary 차원). 필터 순서는 바인딩 순서가 된다.</p>
 *
 * @param groupBy     group by 컬럼명(원본 문자열)
 * @param filters     필터 목록(선언 순서)
 * @param limit       결과 최대 행 수
 * @param rankingMode 랭킹 방식
 */
public record AggregateRequest(
        List<String> groupBy,
        List<Filter> filters,
        int limit,
        RankingMode rankingMode
) {
    public AggregateRequest {
        groupBy = List.copyOf(groupBy);
        filters = List.copyOf(filters);
    }

    /**
     * 하나의 차원에 대한 다중 값 필터 (값들끼리는 OR).
     *
     * @param key    컬럼명 또는 복수형 별칭 (예: artist_name, artists)
     * @param values 허용 값(원본 문자열)
     */
    public record Filter(String key, List<String> values) {
        public Filter {
            values = List.copyOf(values);
        }
    }
}
