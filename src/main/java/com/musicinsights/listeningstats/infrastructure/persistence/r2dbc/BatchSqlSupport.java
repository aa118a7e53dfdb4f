package com.musicinsights.listeningstats.infrastructure.persistence.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * 다중 행 INSERT 배치를 위한 베이스 클래스.
 * <p>
 * 입력을 chunk 단위로 나누어 순차 실행하고 rowsUpdated 를 합산한다.
 * 파라미터 이름은 {@code :<컬럼순번>_<행순번>} 형태로 만든다.
 */
public abstract class BatchSqlSupport {

    protected final DatabaseClient db;

    protected BatchSqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * @param items  전체 입력
     * @param chunk  한 번에 실행할 최대 건수
     * @param onceFn chunk 하나를 실행하고 rowsUpdated 를 돌려주는 함수
     * @return rowsUpdated 합계 (입력이 비어 있으면 0)
     */
    protected <T> Mono<Long> chunkedSum(
            List<T> items,
            int chunk,
            Function<List<T>, Mono<Long>> onceFn
    ) {
        if (items == null || items.isEmpty()) return Mono.just(0L);
        return Flux.fromIterable(items)
                .buffer(chunk)
                .concatMap(onceFn)
                .reduce(0L, Long::sum);
    }

    /**
     * {@code INSERT INTO table (c1, c2) VALUES (:c0_0, :c1_0), (:c0_1, :c1_1)} 형태의 문장을 만든다.
     *
     * @param table   대상 테이블(검증된 식별자)
     * @param columns 컬럼 목록
     * @param rows    행 수
     */
    protected static String multiRowInsert(String table, List<String> columns, int rows) {
        StringBuilder sql = new StringBuilder("INSERT INTO ")
                .append(table)
                .append(" (")
                .append(String.join(", ", columns))
                .append(") VALUES ");

        for (int r = 0; r < rows; r++) {
            if (r > 0) sql.append(", ");
            sql.append("(");
            for (int c = 0; c < columns.size(); c++) {
                if (c > 0) sql.append(", ");
                sql.append(':').append(param(c, r));
            }
            sql.append(")");
        }
        return sql.toString();
    }

    protected static String param(int column, int row) {
        return "c" + column + "_" + row;
    }

    /**
     * null 이면 {@code bindNull}, 아니면 {@code bind}.
     */
    protected <V> DatabaseClient.GenericExecuteSpec bindOrNull(
            DatabaseClient.GenericExecuteSpec spec, String name, V value, Class<V> type
    ) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }
}
