package com.musicinsights.listeningstats.application.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * {@code listening.*} 설정 바인딩.
 *
 * <p>DB 접속 정보는 {@code spring.r2dbc.*}에서 주입받고, 여기서는 조회 대상 테이블과
 * 집계 API/적재 러너의 동작 값만 관리한다.</p>
 *
 * @param table     재생 기록 테이블명(SQL에 그대로 삽입되므로 식별자 패턴만 허용)
 * @param aggregate 집계 API 설정
 * @param ingest    적재 러너 설정
 */
@Validated
@ConfigurationProperties(prefix = "listening")
public record ListeningStatsProperties(
        @DefaultValue("spotify_streams")
        @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*") String table,
        @DefaultValue @NotNull @Valid Aggregate aggregate,
        @DefaultValue @NotNull @Valid Ingest ingest
) {

    /**
     * 집계 API 설정.
     *
     * @param defaultLimit limit 미지정 시 사용할 값
     * @param maxLimit     허용하는 최대 limit
     */
    public record Aggregate(
            @DefaultValue("50") @Min(1) int defaultLimit,
            @DefaultValue("1000") @Min(1) @Max(10000) int maxLimit
    ) {}

    /**
     * 스트리밍 기록 적재 설정.
     *
     * @param inputDir  Spotify 확장 스트리밍 기록(JSON) 파일이 있는 디렉터리
     * @param batchSize 한 트랜잭션에 적재할 레코드 수
     */
    public record Ingest(
            @DefaultValue("data/streaming-history") String inputDir,
            @DefaultValue("1000") @Min(1) int batchSize
    ) {}
}
