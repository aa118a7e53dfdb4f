package com.musicinsights.listeningstats.application.aggregate.repository;

import com.musicinsights.listeningstats.application.aggregate.dimension.Dimension;
import com.musicinsights.listeningstats.application.aggregate.dimension.DimensionType;
import com.musicinsights.listeningstats.application.aggregate.dto.response.AggregateRow;
import com.musicinsights.listeningstats.application.aggregate.query.QueryPlan;
import com.musicinsights.listeningstats.application.common.error.StoreException;
import io.r2dbc.spi.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryPlan}을 실행해 {@link AggregateRow} 목록으로 변환하는 저장소.
 *
 * <p>커넥션 획득/반납은 {@link DatabaseClient}가 구독 단위로 관리한다(완료/에러/취소 시 반납).
 * 결과는 전체를 모은 뒤에만 방출하므로 실패 시 일부 행만 반환되는 일은 없다.</p>
 */
@Component
public class AggregateRepository {
    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final DatabaseClient db;

    public AggregateRepository(DatabaseClient db) {
        this.db = db;
    }

    /**
     * plan 을 실행한다.
     *
     * <p>바인딩은 plan 의 순서(필터 값 → limit) 그대로 index 로 수행한다. 재시도하지 않는다.</p>
     *
     * @param plan 쿼리 plan
     * @return 정렬된 집계 행 전체(없으면 빈 리스트)
     * @throws StoreException DB 실패 시(에러 시그널로 전달)
     */
    public Mono<List<AggregateRow>> execute(QueryPlan plan) {
        DatabaseClient.GenericExecuteSpec spec = db.sql(plan.statementText());

        List<Object> binds = plan.orderedBindValues();
        for (int i = 0; i < binds.size(); i++) {
            spec = spec.bind(i, binds.get(i));
        }

        List<Dimension> dimensions = plan.dimensions();

        return spec.map((row, meta) -> toAggregateRow(row, dimensions))
                .all()
                .collectList()
                .doOnError(e -> log.error("Aggregate query failed: dimensions={}", dimensions, e))
                .onErrorMap(e -> !(e instanceof StoreException),
                        e -> new StoreException("Aggregate query failed", e));
    }

    /**
     * 앞 N개 컬럼은 차원 값, 그 뒤 두 컬럼은 재생 시간 합/재생 수.
     */
    private static AggregateRow toAggregateRow(Row row, List<Dimension> dimensions) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            Dimension d = dimensions.get(i);
            values.put(d.column(), readDimension(row, i, d.type()));
        }

        Number totalMinutes = row.get(dimensions.size(), Number.class);
        Number playCount = row.get(dimensions.size() + 1, Number.class);

        return new AggregateRow(
                values,
                (totalMinutes == null) ? 0.0 : totalMinutes.doubleValue(),
                (playCount == null) ? 0L : playCount.longValue()
        );
    }

    private static Object readDimension(Row row, int index, DimensionType type) {
        if (type == DimensionType.INTEGER) {
            Number n = row.get(index, Number.class);
            return (n == null) ? null : n.intValue();
        }
        return row.get(index, String.class);
    }
}
