package com.musicinsights.listeningstats.application.aggregate.service;

import com.musicinsights.listeningstats.application.aggregate.dto.response.AggregateResponse;
import com.musicinsights.listeningstats.application.aggregate.query.AggregateQueryBuilder;
import com.musicinsights.listeningstats.application.aggregate.query.AggregateRequest;
import com.musicinsights.listeningstats.application.aggregate.query.RankingMode;
import com.musicinsights.listeningstats.application.aggregate.repository.AggregateRepository;
import com.musicinsights.listeningstats.application.common.config.ListeningStatsProperties;
import com.musicinsights.listeningstats.application.common.error.BadRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 재생 기록 동적 집계 서비스 구현체.
 *
 * <p>쿼리스트링 원본 값을 {@link AggregateRequest}로 정리하고, {@link AggregateQueryBuilder}로 검증/변환한 뒤
 * {@link AggregateRepository}로 실행한다. 검증 실패 시 DB 는 호출되지 않는다.</p>
 */
@Service
public class AggregateServiceImpl implements AggregateService {
    private static final Logger log = LoggerFactory.getLogger(AggregateServiceImpl.class);

    private final AggregateQueryBuilder queryBuilder;
    private final AggregateRepository aggregateRepository;
    private final int defaultLimit;

    public AggregateServiceImpl(AggregateQueryBuilder queryBuilder,
                                AggregateRepository aggregateRepository,
                                ListeningStatsProperties properties) {
        this.queryBuilder = queryBuilder;
        this.aggregateRepository = aggregateRepository;
        this.defaultLimit = properties.aggregate().defaultLimit();
    }

    @Override
    public Mono<AggregateResponse> aggregate(
            String groupBy,
            Map<String, List<String>> filters,
            Integer limit,
            boolean topPerGroup
    ) {
        return Mono.fromCallable(() -> queryBuilder.build(toRequest(groupBy, filters, limit, topPerGroup)))
                .doOnNext(plan -> log.debug("Aggregate plan built: dimensions={}, binds={}",
                        plan.dimensions(), plan.orderedBindValues().size()))
                .doOnError(BadRequestException.class, e -> log.warn("Rejected aggregate request: {}", e.getMessage()))
                .flatMap(aggregateRepository::execute)
                .map(AggregateResponse::of);
    }

    private AggregateRequest toRequest(
            String groupBy,
            Map<String, List<String>> filters,
            Integer limit,
            boolean topPerGroup
    ) {
        List<String> columns = Arrays.stream(groupBy.split(",", -1))
                .map(String::trim)
                .toList();

        List<AggregateRequest.Filter> parsed = new ArrayList<>();
        filters.forEach((key, raw) -> parsed.add(new AggregateRequest.Filter(key, splitCsv(raw))));

        return new AggregateRequest(
                columns,
                parsed,
                (limit == null) ? defaultLimit : limit,
                RankingMode.of(topPerGroup)
        );
    }

    /**
     * 반복 파라미터와 쉼표 구분 값을 하나의 목록으로 합친다. 빈 토큰은 버린다.
     */
    private static List<String> splitCsv(List<String> raw) {
        if (raw == null) return List.of();
        return raw.stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
