package com.musicinsights.listeningstats.application.catalog.controller;

import com.musicinsights.listeningstats.application.catalog.dto.response.DataResponse;
import com.musicinsights.listeningstats.application.catalog.service.CatalogService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * 카탈로그(고유 값 목록) 조회 REST 컨트롤러.
 */
@RestController
@RequestMapping("/api")
@Validated
public class CatalogController {
    private final CatalogService service;

    public CatalogController(CatalogService service) {
        this.service = service;
    }

    /** 전체 아티스트(알파벳순) */
    @GetMapping("/artists")
    public Mono<DataResponse<String>> artists() {
        return service.artists();
    }

    @GetMapping("/tracks")
    public Mono<DataResponse<String>> tracks() {
        return service.tracks();
    }

    @GetMapping("/albums")
    public Mono<DataResponse<String>> albums() {
        return service.albums();
    }

    @GetMapping("/years")
    public Mono<DataResponse<Integer>> years() {
        return service.years();
    }

    /** group by 가능한 컬럼 */
    @GetMapping("/columns")
    public Mono<DataResponse<String>> columns() {
        return service.columns();
    }

    /**
     * 재생 시간 기준 상위 아티스트를 조회한다.
     *
     * @param limit     조회 개수(기본 20, 1~100)
     * @param startDate 시작일(yyyy-MM-dd, 포함)
     * @param endDate   종료일(yyyy-MM-dd, 포함)
     * @return 아티스트 이름 목록
     */
    @GetMapping("/artists/top")
    public Mono<DataResponse<String>> topArtists(
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        return service.topArtists(limit, startDate, endDate);
    }
}
