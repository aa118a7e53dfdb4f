package com.musicinsights.listeningstats.infrastructure.mapper;

import com.musicinsights.listeningstats.infrastructure.input.history.StreamingHistoryEntry;
import com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.row.PlayRecordRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;

/**
 * 원본 스트리밍 기록 항목을 {@link PlayRecordRow}로 정제한다.
 * <p>
 * - 팟캐스트(episode_name 존재)와 재생 시각이 없는 항목은 제외
 * - ts(UTC)에서 date/year/month/day_of_week/hour 추출
 * - ms_played → minutes_played(소수 2자리)
 * - 트랙/아티스트/앨범 누락 시 Unknown 값으로 채움 (group by 차원에 null 이 없도록)
 */
@Component
public class StreamingHistoryMapper {

    public static final String UNKNOWN_TRACK = "Unknown Track";
    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    public static final String UNKNOWN_ALBUM = "Unknown Album";

    private static final BigDecimal MS_PER_MINUTE = BigDecimal.valueOf(60_000);

    /**
     * 음악 재생 항목만 골라 행으로 변환한다.
     *
     * @param entries 원본 항목 배치
     * @return 적재할 행 목록
     */
    public List<PlayRecordRow> toRows(List<StreamingHistoryEntry> entries) {
        return entries.stream()
                .filter(this::isMusicPlay)
                .map(this::toRow)
                .toList();
    }

    public boolean isMusicPlay(StreamingHistoryEntry e) {
        return e != null && e.episodeName() == null && e.ts() != null && !e.ts().isBlank();
    }

    /**
     * @param e 음악 재생 항목({@link #isMusicPlay} 통과)
     * @return 정제된 행
     * @throws java.time.format.DateTimeParseException ts 형식이 ISO-8601 이 아닌 경우
     */
    public PlayRecordRow toRow(StreamingHistoryEntry e) {
        ZonedDateTime playedAt = Instant.parse(e.ts()).atZone(ZoneOffset.UTC);
        long ms = (e.msPlayed() == null) ? 0L : e.msPlayed();

        String trackId = (e.trackName() == null || e.artistName() == null)
                ? null
                : e.trackName() + " - " + e.artistName();

        return new PlayRecordRow(
                ms,
                e.connCountry(),
                orDefault(e.trackName(), UNKNOWN_TRACK),
                orDefault(e.artistName(), UNKNOWN_ARTIST),
                orDefault(e.albumName(), UNKNOWN_ALBUM),
                e.reasonStart(),
                e.reasonEnd(),
                e.shuffle(),
                e.skipped(),
                e.incognitoMode(),
                playedAt.toLocalDate(),
                playedAt.getYear(),
                playedAt.getMonthValue(),
                playedAt.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                playedAt.getHour(),
                BigDecimal.valueOf(ms).divide(MS_PER_MINUTE, 2, RoundingMode.HALF_UP),
                ms > 0,
                trackId
        );
    }

    private static String orDefault(String value, String fallback) {
        return (value == null) ? fallback : value;
    }
}
