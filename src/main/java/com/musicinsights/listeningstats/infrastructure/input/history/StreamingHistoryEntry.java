package com.musicinsights.listeningstats.infrastructure.input.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Spotify 확장 스트리밍 기록(Streaming_History_Audio_*.json) 항목 1건.
 *
 * <p>원본 필드명을 {@link JsonProperty}로 그대로 매핑하며, 사용하지 않는 필드(ip_addr, platform 등)는 무시한다.</p>
 *
 * @param ts            재생 종료 시각(ISO-8601, UTC)
 * @param msPlayed      재생 시간(ms)
 * @param connCountry   접속 국가 코드
 * @param trackName     트랙명
 * @param artistName    아티스트명
 * @param albumName     앨범명
 * @param reasonStart   재생 시작 사유
 * @param reasonEnd     재생 종료 사유
 * @param shuffle       셔플 여부
 * @param skipped       스킵 여부
 * @param incognitoMode 비공개 세션 여부
 * @param episodeName   팟캐스트 에피소드명(음악이면 null)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamingHistoryEntry(
        @JsonProperty("ts") String ts,
        @JsonProperty("ms_played") Long msPlayed,
        @JsonProperty("conn_country") String connCountry,
        @JsonProperty("master_metadata_track_name") String trackName,
        @JsonProperty("master_metadata_album_artist_name") String artistName,
        @JsonProperty("master_metadata_album_album_name") String albumName,
        @JsonProperty("reason_start") String reasonStart,
        @JsonProperty("reason_end") String reasonEnd,
        @JsonProperty("shuffle") Boolean shuffle,
        @JsonProperty("skipped") Boolean skipped,
        @JsonProperty("incognito_mode") Boolean incognitoMode,
        @JsonProperty("episode_name") String episodeName
) {}
