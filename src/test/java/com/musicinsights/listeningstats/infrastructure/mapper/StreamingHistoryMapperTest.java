package com.musicinsights.listeningstats.infrastructure.mapper;

import com.musicinsights.listeningstats.infrastructure.input.history.StreamingHistoryEntry;
import com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.row.PlayRecordRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link StreamingHistoryMapper} 단위 테스트.
 */
@DisplayName("streaming history mapper 테스트")
class StreamingHistoryMapperTest {

    private final StreamingHistoryMapper mapper = new StreamingHistoryMapper();

    private static StreamingHistoryEntry music(String ts, Long ms, String track, String artist, String album) {
        return new StreamingHistoryEntry(ts, ms, "KR", track, artist, album,
                "clickrow", "trackdone", false, false, false, null);
    }

    @Test
    @DisplayName("ts(UTC)에서 날짜/연/월/요일/시를 추출하고 분 단위 재생 시간을 계산")
    void toRow_derivesTimeFields() {
        PlayRecordRow row = mapper.toRow(music("2023-03-05T23:15:00Z", 185_000L, "Ditto", "NewJeans", "OMG"));

        assertThat(row.date()).isEqualTo(LocalDate.of(2023, 3, 5));
        assertThat(row.year()).isEqualTo(2023);
        assertThat(row.month()).isEqualTo(3);
        assertThat(row.dayOfWeek()).isEqualTo("Sunday");
        assertThat(row.hour()).isEqualTo(23);
        assertThat(row.minutesPlayed()).isEqualByComparingTo(new BigDecimal("3.08"));
        assertThat(row.validListen()).isTrue();
        assertThat(row.trackId()).isEqualTo("Ditto - NewJeans");
        assertThat(row.connCountry()).isEqualTo("KR");
        assertThat(row.reasonEnd()).isEqualTo("trackdone");
    }

    @Test
    @DisplayName("메타데이터 누락 시 Unknown 값, track_id 는 null")
    void toRow_fillsUnknowns() {
        PlayRecordRow row = mapper.toRow(music("2021-01-01T00:00:00Z", 0L, null, "Artist", null));

        assertThat(row.trackName()).isEqualTo(StreamingHistoryMapper.UNKNOWN_TRACK);
        assertThat(row.artistName()).isEqualTo("Artist");
        assertThat(row.albumName()).isEqualTo(StreamingHistoryMapper.UNKNOWN_ALBUM);
        assertThat(row.trackId()).isNull();
        assertThat(row.validListen()).isFalse();
        assertThat(row.minutesPlayed()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("ms_played 가 없으면 0 으로 취급")
    void toRow_nullMsPlayed() {
        PlayRecordRow row = mapper.toRow(music("2021-06-15T12:00:00Z", null, "T", "A", "B"));

        assertThat(row.msPlayed()).isZero();
        assertThat(row.validListen()).isFalse();
        assertThat(row.artistName()).isEqualTo("A");
    }

    @Test
    @DisplayName("팟캐스트/ts 없는 항목은 제외")
    void toRows_filtersNonMusic() {
        StreamingHistoryEntry podcast = new StreamingHistoryEntry("2022-01-01T10:00:00Z", 60_000L, "KR",
                null, null, null, null, null, null, null, null, "Episode 1");
        StreamingHistoryEntry noTs = music(null, 1000L, "T", "A", "B");
        StreamingHistoryEntry ok = music("2022-01-01T10:00:00Z", 60_000L, "T", "A", "B");

        List<PlayRecordRow> rows = mapper.toRows(List.of(podcast, noTs, ok));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).minutesPlayed()).isEqualByComparingTo(new BigDecimal("1.00"));
        assertThat(rows.get(0).dayOfWeek()).isEqualTo("Saturday");
    }
}
