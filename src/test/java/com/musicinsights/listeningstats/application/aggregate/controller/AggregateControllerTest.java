package com.musicinsights.listeningstats.application.aggregate.controller;

import com.musicinsights.listeningstats.application.aggregate.dto.response.AggregateResponse;
import com.musicinsights.listeningstats.application.aggregate.dto.response.AggregateRow;
import com.musicinsights.listeningstats.application.aggregate.service.AggregateService;
import com.musicinsights.listeningstats.application.common.error.GlobalExceptionHandler;
import com.musicinsights.listeningstats.application.common.error.InvalidDimensionException;
import com.musicinsights.listeningstats.application.common.error.LimitOutOfRangeException;
import com.musicinsights.listeningstats.application.common.error.StoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webflux.test.autoconfigure.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * {@link AggregateController} WebFlux 슬라이스 테스트.
 *
 * <p>filter_* 파라미터 추출, 응답 바디 구조, 에러 코드 매핑을 검증한다.</p>
 */
@DisplayName("aggregate controller 테스트")
@WebFluxTest(controllers = AggregateController.class)
@Import(GlobalExceptionHandler.class)
class AggregateControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockitoBean
    AggregateService service;

    @Test
    @DisplayName("200 응답: data 배열에 차원 값 + total_minutes + play_count")
    void ok_returnsRows() {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("year", 2020);
        b.put("artist_name", "B");
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("year", 2020);
        a.put("artist_name", "A");

        when(service.aggregate(eq("year,artist_name"), anyMap(), eq(10), eq(false)))
                .thenReturn(Mono.just(AggregateResponse.of(List.of(
                        new AggregateRow(b, 20.0, 1L),
                        new AggregateRow(a, 10.0, 1L)))));

        webTestClient.get()
                .uri("/api/aggregate?group_by=year,artist_name&limit=10")
                .accept(MediaType.APPLICATION_JSON)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(2)
                .jsonPath("$.data[0].year").isEqualTo(2020)
                .jsonPath("$.data[0].artist_name").isEqualTo("B")
                .jsonPath("$.data[0].total_minutes").isEqualTo(20.0)
                .jsonPath("$.data[0].play_count").isEqualTo(1)
                .jsonPath("$.data[1].artist_name").isEqualTo("A");
    }

    @Test
    @DisplayName("filter_ 접두사 파라미터만 필터로 전달 (접두사 제거, 반복 값 유지)")
    @SuppressWarnings("unchecked")
    void filters_extractedFromQuery() {
        when(service.aggregate(anyString(), anyMap(), any(), anyBoolean()))
                .thenReturn(Mono.just(AggregateResponse.of(List.of())));

        webTestClient.get()
                .uri("/api/aggregate?group_by=artist_name&filter_artists=A,B&filter_artists=C&filter_years=2020&top_per_group=true&other=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(0);

        ArgumentCaptor<Map<String, List<String>>> captor = ArgumentCaptor.forClass(Map.class);
        verify(service).aggregate(eq("artist_name"), captor.capture(), isNull(), eq(true));

        assertThat(captor.getValue()).containsOnlyKeys("artists", "years");
        assertThat(captor.getValue().get("artists")).containsExactly("A,B", "C");
        assertThat(captor.getValue().get("years")).containsExactly("2020");
    }

    @Test
    @DisplayName("잘못된 컬럼 → 400 INVALID_DIMENSION")
    void invalidDimension_400() {
        when(service.aggregate(anyString(), anyMap(), any(), anyBoolean()))
                .thenReturn(Mono.error(new InvalidDimensionException("secret")));

        webTestClient.get()
                .uri("/api/aggregate?group_by=secret")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.code").isEqualTo("INVALID_DIMENSION")
                .jsonPath("$.message").isEqualTo("Invalid column: secret")
                .jsonPath("$.path").isEqualTo("/api/aggregate");
    }

    @Test
    @DisplayName("limit 범위 오류 → 400 LIMIT_OUT_OF_RANGE")
    void limitOutOfRange_400() {
        when(service.aggregate(anyString(), anyMap(), eq(1001), anyBoolean()))
                .thenReturn(Mono.error(new LimitOutOfRangeException(1001, 1, 1000)));

        webTestClient.get()
                .uri("/api/aggregate?group_by=year&limit=1001")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("LIMIT_OUT_OF_RANGE");
    }

    @Test
    @DisplayName("DB 실패 → 500 DB_ERROR")
    void storeFailure_500() {
        when(service.aggregate(anyString(), anyMap(), any(), anyBoolean()))
                .thenReturn(Mono.error(new StoreException("Aggregate query failed", new RuntimeException("down"))));

        webTestClient.get()
                .uri("/api/aggregate?group_by=year")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.status").isEqualTo(500)
                .jsonPath("$.code").isEqualTo("DB_ERROR");
    }

    @Test
    @DisplayName("group_by 누락 / limit 타입 오류 → 400 VALIDATION_ERROR, 서비스 미호출")
    void missingOrMalformedParams_400() {
        webTestClient.get()
                .uri("/api/aggregate")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");

        webTestClient.get()
                .uri("/api/aggregate?group_by=year&limit=abc")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");

        verifyNoInteractions(service);
    }
}
