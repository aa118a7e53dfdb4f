package com.musicinsights.listeningstats.application.catalog.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 목록 조회 API 공통 응답 DTO. 키는 기존 클라이언트 호환을 위해 대문자 "Data"를 쓴다.
 *
 * @param data 값 목록
 * @param <T>  값 타입
 */
public record DataResponse<T>(
        @JsonProperty("Data") List<T> data
) {}
