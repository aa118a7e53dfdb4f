package com.musicinsights.listeningstats.application.catalog.service;

import com.musicinsights.listeningstats.application.aggregate.dimension.DimensionRegistry;
import com.musicinsights.listeningstats.application.catalog.dto.response.DataResponse;
import com.musicinsights.listeningstats.application.catalog.repository.CatalogRepository;
import com.musicinsights.listeningstats.application.common.error.BadRequestException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * 카탈로그 서비스.
 *
 * <p>집계 화면의 선택지(아티스트/트랙/앨범/연도/컬럼)를 제공한다.</p>
 */
@Service
public class CatalogService {
    private final CatalogRepository catalogRepository;

    public CatalogService(CatalogRepository catalogRepository) {
        this.catalogRepository = catalogRepository;
    }

    public Mono<DataResponse<String>> artists() {
        return wrap(catalogRepository.findArtists());
    }

    public Mono<DataResponse<String>> tracks() {
        return wrap(catalogRepository.findTracks());
    }

    public Mono<DataResponse<String>> albums() {
        return wrap(catalogRepository.findAlbums());
    }

    public Mono<DataResponse<Integer>> years() {
        return wrap(catalogRepository.findYears());
    }

    /**
     * group by 에 사용할 수 있는 컬럼 목록. DB 메타데이터가 아니라 허용 목록을 그대로 반환한다.
     *
     * @return 컬럼명 목록
     */
    public Mono<DataResponse<String>> columns() {
        return Mono.just(new DataResponse<>(DimensionRegistry.names()));
    }

    /**
     * 재생 시간 합 기준 상위 아티스트를 조회한다.
     *
     * @param limit     조회 개수
     * @param startDate 시작일(nullable)
     * @param endDate   종료일(nullable)
     * @return 아티스트 이름 목록
     */
    public Mono<DataResponse<String>> topArtists(int limit, LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            return Mono.error(new BadRequestException(
                    "start_date must not be after end_date", "INVALID_DATE_RANGE"));
        }
        return wrap(catalogRepository.findTopArtists(limit, startDate, endDate));
    }

    private static <T> Mono<DataResponse<T>> wrap(Flux<T> values) {
        return values.collectList().map(DataResponse::new);
    }
}
