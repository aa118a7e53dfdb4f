package com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.listeningstats.application.common.config.ListeningStatsProperties;
import com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.row.PlayRecordRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 재생 기록 테이블에 대한 배치 저장/건수 조회 Repository.
 */
@Component
public class PlayRecordRepo extends BatchSqlSupport {

    /** 한 INSERT 문에 담을 최대 행 수 (18컬럼 x 500행 = 9000 파라미터) */
    private static final int CHUNK = 500;

    static final List<String> COLUMNS = List.of(
            "ms_played", "conn_country", "track_name", "artist_name", "album_name",
            "reason_start", "reason_end", "shuffle", "skipped", "incognito_mode",
            "date", "year", "month", "day_of_week", "hour",
            "minutes_played", "is_valid_listen", "track_id"
    );

    private final String table;

    public PlayRecordRepo(DatabaseClient db, ListeningStatsProperties properties) {
        super(db);
        this.table = properties.table();
    }

    /**
     * 행 목록을 CHUNK 단위 다중 행 INSERT 로 저장한다.
     *
     * @param rows 저장할 행
     * @return 삽입된 행 수 합계
     */
    public Mono<Long> insertAll(List<PlayRecordRow> rows) {
        return chunkedSum(rows, CHUNK, this::insertOnce);
    }

    private Mono<Long> insertOnce(List<PlayRecordRow> rows) {
        if (rows.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(multiRowInsert(table, COLUMNS, rows.size()));
        for (int i = 0; i < rows.size(); i++) {
            PlayRecordRow r = rows.get(i);
            spec = spec.bind(param(0, i), r.msPlayed());
            spec = bindOrNull(spec, param(1, i), r.connCountry(), String.class);
            spec = spec.bind(param(2, i), r.trackName())
                    .bind(param(3, i), r.artistName())
                    .bind(param(4, i), r.albumName());
            spec = bindOrNull(spec, param(5, i), r.reasonStart(), String.class);
            spec = bindOrNull(spec, param(6, i), r.reasonEnd(), String.class);
            spec = bindOrNull(spec, param(7, i), r.shuffle(), Boolean.class);
            spec = bindOrNull(spec, param(8, i), r.skipped(), Boolean.class);
            spec = bindOrNull(spec, param(9, i), r.incognitoMode(), Boolean.class);
            spec = bindOrNull(spec, param(10, i), r.date(), LocalDate.class);
            spec = spec.bind(param(11, i), r.year())
                    .bind(param(12, i), r.month())
                    .bind(param(13, i), r.dayOfWeek())
                    .bind(param(14, i), r.hour());
            spec = bindOrNull(spec, param(15, i), r.minutesPlayed(), BigDecimal.class);
            spec = spec.bind(param(16, i), r.validListen());
            spec = bindOrNull(spec, param(17, i), r.trackId(), String.class);
        }

        return spec.fetch().rowsUpdated();
    }

    /**
     * @return 테이블 전체 행 수
     */
    public Mono<Long> countAll() {
        return db.sql("SELECT COUNT(*) AS cnt FROM " + table)
                .map((row, meta) -> row.get("cnt", Number.class).longValue())
                .one()
                .defaultIfEmpty(0L);
    }
}
