package com.musicinsights.listeningstats.application.aggregate.query;

/**
 * 동적 집계 쿼리 템플릿 모음.
 *
 * <p>%1$s 등 자리에는 {@link com.musicinsights.listeningstats.application.aggregate.dimension.DimensionRegistry}로
 * 검증된 컬럼명과 설정으로 검증된 테이블명만 들어간다. 값은 모두 ? 로 바인딩한다.</p>
 */
final class AggregateSql {
    private AggregateSql() {}

    /** 필터가 없을 때의 WHERE 조건 */
    static final String ALWAYS_TRUE = "1=1";

    /**
     * 요청한 차원 조합별 재생 시간 합/재생 수, 재생 시간 DESC.
     * <p>1: 컬럼 목록, 2: 테이블, 3: WHERE 조건</p>
     */
    static final String SQL_PLAIN = """
        SELECT %1$s,
               SUM(minutes_played) AS total_minutes,
               COUNT(*) AS play_count
        FROM %2$s
        WHERE %3$s
        GROUP BY %1$s
        ORDER BY total_minutes DESC
        LIMIT ?
        """;

    /**
     * primary 차원별 재생 시간 1위 조합만 남긴다.
     * <p>1: 컬럼 목록, 2: primary 컬럼, 3: 테이블, 4: WHERE 조건</p>
     * <p>같은 파티션 안에서 합계가 같으면 어느 행이 rn=1이 될지는 DB 행 순서에 따른다.</p>
     */
    static final String SQL_TOP_PER_GROUP = """
        WITH ranked AS (
            SELECT %1$s,
                   SUM(minutes_played) AS total_minutes,
                   COUNT(*) AS play_count,
                   ROW_NUMBER() OVER (PARTITION BY %2$s ORDER BY SUM(minutes_played) DESC) AS rn
            FROM %3$s
            WHERE %4$s
            GROUP BY %1$s
        )
        SELECT %1$s, total_minutes, play_count
        FROM ranked
        WHERE rn = 1
        ORDER BY total_minutes DESC
        LIMIT ?
        """;

    static String plain(String columns, String table, String where) {
        return SQL_PLAIN.formatted(columns, table, where);
    }

    static String topPerGroup(String columns, String primary, String table, String where) {
        return SQL_TOP_PER_GROUP.formatted(columns, primary, table, where);
    }
}
