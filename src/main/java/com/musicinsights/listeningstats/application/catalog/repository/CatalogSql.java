package com.musicinsights.listeningstats.application.catalog.repository;

/**
 * 카탈로그(고유 값 목록) 조회용 SQL 템플릿. %s 자리에는 설정으로 검증된 테이블명이 들어간다.
 */
final class CatalogSql {
    private CatalogSql() {}

    static final String SQL_DISTINCT_ARTISTS = """
        SELECT DISTINCT artist_name AS name
        FROM %s
        ORDER BY artist_name
        """;

    static final String SQL_DISTINCT_TRACKS = """
        SELECT DISTINCT track_name AS name
        FROM %s
        ORDER BY track_name
        """;

    static final String SQL_DISTINCT_ALBUMS = """
        SELECT DISTINCT album_name AS name
        FROM %s
        ORDER BY album_name
        """;

    static final String SQL_DISTINCT_YEARS = """
        SELECT DISTINCT year
        FROM %s
        ORDER BY year
        """;

    /** 재생 시간 합 기준 상위 아티스트. 2번째 %s 는 날짜 조건(없으면 1=1) */
    static final String SQL_TOP_ARTISTS = """
        SELECT artist_name, SUM(minutes_played) AS total_minutes
        FROM %s
        WHERE %s
        GROUP BY artist_name
        ORDER BY total_minutes DESC
        LIMIT ?
        """;
}
