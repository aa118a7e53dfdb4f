package com.musicinsights.listeningstats.application.aggregate.controller;

import com.musicinsights.listeningstats.application.aggregate.dto.response.AggregateResponse;
import com.musicinsights.listeningstats.application.aggregate.service.AggregateService;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 재생 기록 동적 집계 REST 컨트롤러.
 *
 * <p>group_by/filter_* 값의 검증은 서비스(쿼리 빌더)에서 수행하며, 여기서는 쿼리스트링을 그대로 넘긴다.</p>
 */
@RestController
@RequestMapping("/api")
public class AggregateController {
    static final String FILTER_PREFIX = "filter_";

    private final AggregateService service;

    public AggregateController(AggregateService service) {
        this.service = service;
    }

    /**
     * 요청한 차원 조합별 재생 시간 합/재생 수를 조회한다.
     *
     * @param groupBy     쉼표로 구분된 컬럼명(순서 유지, 첫 번째가 primary)
     * @param limit       결과 행 수(기본 50, 1~1000)
     * @param topPerGroup primary 차원 값마다 1위만 반환할지 여부
     * @param params      전체 쿼리 파라미터(filter_* 추출용)
     * @return {"data": [...]}
     */
    @GetMapping("/aggregate")
    public Mono<AggregateResponse> aggregate(
            @RequestParam("group_by") String groupBy,
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "top_per_group", defaultValue = "false") boolean topPerGroup,
            @RequestParam MultiValueMap<String, String> params
    ) {
        return service.aggregate(groupBy, filterParams(params), limit, topPerGroup);
    }

    private static Map<String, List<String>> filterParams(MultiValueMap<String, String> params) {
        Map<String, List<String>> filters = new LinkedHashMap<>();
        params.forEach((name, values) -> {
            if (name.startsWith(FILTER_PREFIX)) {
                filters.put(name.substring(FILTER_PREFIX.length()), values);
            }
        });
        return filters;
    }
}
