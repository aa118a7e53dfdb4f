package com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.row;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * spotify_streams 테이블 1행(정제된 재생 기록).
 *
 * @param msPlayed      재생 시간(ms)
 * @param connCountry   접속 국가 코드
 * @param trackName     트랙명(없으면 Unknown Track)
 * @param artistName    아티스트명(없으면 Unknown Artist)
 * @param albumName     앨범명(없으면 Unknown Album)
 * @param reasonStart   재생 시작 사유
 * @param reasonEnd     재생 종료 사유
 * @param shuffle       셔플 여부
 * @param skipped       스킵 여부
 * @param incognitoMode 비공개 세션 여부
 * @param date          재생일(UTC)
 * @param year          연도
 * @param month         월(1~12)
 * @param dayOfWeek     요일(영문, 예: Monday)
 * @param hour          시(0~23)
 * @param minutesPlayed 재생 시간(분, 소수 2자리)
 * @param validListen   ms_played > 0 여부
 * @param trackId       "트랙 - 아티스트" (원본 값 중 하나라도 없으면 null)
 */
public record PlayRecordRow(
        long msPlayed,
        String connCountry,
        String trackName,
        String artistName,
        String albumName,
        String reasonStart,
        String reasonEnd,
        Boolean shuffle,
        Boolean skipped,
        Boolean incognitoMode,
        LocalDate date,
        int year,
        int month,
        String dayOfWeek,
        int hour,
        BigDecimal minutesPlayed,
        boolean validListen,
        String trackId
) {}
