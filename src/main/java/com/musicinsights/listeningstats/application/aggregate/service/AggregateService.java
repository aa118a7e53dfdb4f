package com.musicinsights.listeningstats.application.aggregate.service;

import com.musicinsights.listeningstats.application.aggregate.dto.response.AggregateResponse;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 재생 기록 동적 집계 서비스
 */
public interface AggregateService {

    /**
     * 요청한 차원으로 재생 기록을 집계한다.
     *
     * @param groupBy     쉼표로 구분된 group by 컬럼명
     * @param filters     "filter_" 접두사를 뗀 키 → 쉼표 구분 값 목록(선언 순서)
     * @param limit       결과 행 수(없으면 기본값)
     * @param topPerGroup primary 차원별 1위만 남길지 여부
     * @return 집계 결과. 요청 오류는 BadRequestException, DB 오류는 StoreException 시그널
     */
    Mono<AggregateResponse> aggregate(
            String groupBy,
            Map<String, List<String>> filters,
            Integer limit,
            boolean topPerGroup
    );
}
