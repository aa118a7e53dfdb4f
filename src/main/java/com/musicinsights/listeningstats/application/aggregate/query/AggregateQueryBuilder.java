package com.musicinsights.listeningstats.application.aggregate.query;

import com.musicinsights.listeningstats.application.aggregate.dimension.Dimension;
import com.musicinsights.listeningstats.application.aggregate.dimension.DimensionRegistry;
import com.musicinsights.listeningstats.application.common.config.ListeningStatsProperties;
import com.musicinsights.listeningstats.application.common.error.BadRequestException;
import com.musicinsights.listeningstats.application.common.error.InvalidDimensionException;
import com.musicinsights.listeningstats.application.common.error.InvalidFilterValueException;
import com.musicinsights.listeningstats.application.common.error.LimitOutOfRangeException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link AggregateRequest}를 검증하고 파라미터 바인딩 방식의 {@link QueryPlan}으로 변환한다.
 *
 * <p>검증(limit → group by → filter)이 모두 끝난 뒤에만 SQL 문자열을 조립한다.
 * 부수효과가 없으며 같은 요청에는 항상 같은 plan 을 반환한다.</p>
 */
@Component
public class AggregateQueryBuilder {
    static final int MIN_LIMIT = 1;

    private final String table;
    private final int maxLimit;

    public AggregateQueryBuilder(ListeningStatsProperties properties) {
        this.table = properties.table();
        this.maxLimit = properties.aggregate().maxLimit();
    }

    /**
     * 요청을 검증하고 쿼리 plan 을 만든다.
     *
     * @param request 집계 요청
     * @return SQL + 바인딩 값
     * @throws LimitOutOfRangeException    limit 이 [1, maxLimit] 밖인 경우
     * @throws InvalidDimensionException   허용되지 않은 group by/filter 컬럼
     * @throws InvalidFilterValueException 정수 차원의 필터 값이 정수가 아닌 경우
     */
    public QueryPlan build(AggregateRequest request) {
        if (request.limit() < MIN_LIMIT || request.limit() > maxLimit) {
            throw new LimitOutOfRangeException(request.limit(), MIN_LIMIT, maxLimit);
        }

        List<Dimension> dimensions = resolveGroupBy(request.groupBy());
        Map<Dimension, List<Object>> filters = resolveFilters(request.filters());

        List<Object> binds = new ArrayList<>();
        List<String> predicates = new ArrayList<>();
        filters.forEach((dimension, values) -> {
            String placeholders = String.join(", ", Collections.nCopies(values.size(), "?"));
            predicates.add(dimension.column() + " IN (" + placeholders + ")");
            binds.addAll(values);
        });
        binds.add(request.limit());

        String where = predicates.isEmpty() ? AggregateSql.ALWAYS_TRUE : String.join(" AND ", predicates);
        String columns = dimensions.stream()
                .map(Dimension::column)
                .collect(Collectors.joining(", "));

        String sql = isTopPerGroup(request, dimensions)
                ? AggregateSql.topPerGroup(columns, dimensions.get(0).column(), table, where)
                : AggregateSql.plain(columns, table, where);

        return new QueryPlan(dimensions, sql, binds);
    }

    private static boolean isTopPerGroup(AggregateRequest request, List<Dimension> dimensions) {
        return request.rankingMode() == RankingMode.TOP_PER_PRIMARY_GROUP && dimensions.size() > 1;
    }

    private static List<Dimension> resolveGroupBy(List<String> groupBy) {
        if (groupBy.isEmpty()) {
            throw new InvalidDimensionException("");
        }

        Set<Dimension> resolved = new LinkedHashSet<>();
        for (String name : groupBy) {
            if (!DimensionRegistry.isValidDimension(name)) {
                throw new InvalidDimensionException(name);
            }
            Dimension d = DimensionRegistry.find(name).orElseThrow();
            if (!resolved.add(d)) {
                throw new BadRequestException("Duplicate column: " + name, "DUPLICATE_DIMENSION");
            }
        }
        return List.copyOf(resolved);
    }

    /**
     * 필터를 차원별로 합친다. 같은 차원을 별칭과 컬럼명으로 나눠 보내도 하나의 IN 목록(OR)이 된다.
     * 빈 값 목록의 필터는 키만 검증하고 조건에서는 제외한다.
     *
     * @return 차원 → 바인딩 값 (처음 등장한 순서 유지)
     */
    private static Map<Dimension, List<Object>> resolveFilters(List<AggregateRequest.Filter> filters) {
        Map<Dimension, List<Object>> resolved = new LinkedHashMap<>();
        for (AggregateRequest.Filter f : filters) {
            Dimension d = DimensionRegistry.findByFilterKey(f.key())
                    .orElseThrow(() -> new InvalidDimensionException(f.key()));
            if (f.values().isEmpty()) {
                continue;
            }

            List<Object> values = resolved.computeIfAbsent(d, k -> new ArrayList<>());
            for (String raw : f.values()) {
                try {
                    values.add(d.type().parse(raw));
                } catch (NumberFormatException e) {
                    throw new InvalidFilterValueException(d.column(), raw);
                }
            }
        }
        return resolved;
    }
}
