package com.musicinsights.listeningstats.application.catalog.repository;

import com.musicinsights.listeningstats.application.common.config.ListeningStatsProperties;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.musicinsights.listeningstats.application.catalog.repository.CatalogSql.*;

/**
 * 재생 기록 테이블의 고유 값 목록 조회 저장소.
 */
@Component
public class CatalogRepository {
    private final DatabaseClient db;
    private final String table;

    public CatalogRepository(DatabaseClient db, ListeningStatsProperties properties) {
        this.db = db;
        this.table = properties.table();
    }

    public Flux<String> findArtists() {
        return findNames(SQL_DISTINCT_ARTISTS);
    }

    public Flux<String> findTracks() {
        return findNames(SQL_DISTINCT_TRACKS);
    }

    public Flux<String> findAlbums() {
        return findNames(SQL_DISTINCT_ALBUMS);
    }

    public Flux<Integer> findYears() {
        return db.sql(SQL_DISTINCT_YEARS.formatted(table))
                .map((row, meta) -> row.get("year", Number.class).intValue())
                .all();
    }

    /**
     * 재생 시간 합 기준 상위 아티스트 이름을 조회한다.
     *
     * <p>날짜 범위는 양 끝 포함이며, null 인 쪽은 조건에서 제외한다.</p>
     *
     * @param limit     조회 개수
     * @param startDate 시작일(포함, nullable)
     * @param endDate   종료일(포함, nullable)
     * @return 아티스트 이름(재생 시간 DESC)
     */
    public Flux<String> findTopArtists(int limit, LocalDate startDate, LocalDate endDate) {
        List<String> where = new ArrayList<>();
        List<Object> binds = new ArrayList<>();

        if (startDate != null) {
            where.add("date >= ?");
            binds.add(startDate);
        }
        if (endDate != null) {
            where.add("date <= ?");
            binds.add(endDate);
        }
        binds.add(limit);

        String whereSql = where.isEmpty() ? "1=1" : String.join(" AND ", where);

        DatabaseClient.GenericExecuteSpec spec = db.sql(SQL_TOP_ARTISTS.formatted(table, whereSql));
        for (int i = 0; i < binds.size(); i++) {
            spec = spec.bind(i, binds.get(i));
        }

        return spec.map((row, meta) -> row.get("artist_name", String.class)).all();
    }

    private Flux<String> findNames(String sqlTemplate) {
        return db.sql(sqlTemplate.formatted(table))
                .map((row, meta) -> row.get("name", String.class))
                .all();
    }
}
