package com.musicinsights.listeningstats.application.aggregate.dimension;

import com.musicinsights.listeningstats.application.common.error.InvalidDimensionException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 집계 차원 허용 목록(allow-list).
 *
 * <p>컬럼명은 값처럼 바인딩할 수 없으므로, 요청으로 들어온 이름은 반드시 이 레지스트리를 거쳐
 * {@link Dimension}으로 변환된 뒤에만 SQL에 삽입된다. 상태가 없는 순수 조회이다.</p>
 */
public final class DimensionRegistry {

    private static final Map<String, Dimension> BY_COLUMN = new LinkedHashMap<>();
    private static final Map<String, Dimension> BY_FILTER_KEY = new LinkedHashMap<>();

    static {
        for (Dimension d : Dimension.values()) {
            BY_COLUMN.put(d.column(), d);
            BY_FILTER_KEY.put(d.column(), d);
            BY_FILTER_KEY.put(d.filterAlias(), d);
        }
    }

    private DimensionRegistry() {}

    /**
     * 컬럼명이 허용 목록에 있는지 확인한다.
     *
     * @param name 컬럼명
     * @return 허용 여부(null 이면 false)
     */
    public static boolean isValidDimension(String name) {
        return name != null && BY_COLUMN.containsKey(name);
    }

    /**
     * 컬럼의 값 타입을 반환한다.
     *
     * @param name 컬럼명
     * @return 값 타입
     * @throws InvalidDimensionException 허용되지 않은 이름인 경우
     */
    public static DimensionType typeOf(String name) {
        return find(name)
                .map(Dimension::type)
                .orElseThrow(() -> new InvalidDimensionException(name));
    }

    /**
     * {@link #isValidDimension}와 같은 허용 목록 검사를 하면서 차원 자체를 돌려준다.
     *
     * @param name 컬럼명
     * @return 허용 목록에 있으면 해당 차원
     */
    public static Optional<Dimension> find(String name) {
        return Optional.ofNullable(name).map(BY_COLUMN::get);
    }

    /**
     * filter_ 파라미터 키로 차원을 찾는다. 컬럼명과 복수형 별칭 둘 다 허용한다.
     *
     * @param key "filter_" 접두사를 뗀 키 (예: artists, artist_name)
     * @return 매칭된 차원
     */
    public static Optional<Dimension> findByFilterKey(String key) {
        return Optional.ofNullable(key).map(BY_FILTER_KEY::get);
    }

    /** 허용된 컬럼명 목록(선언 순서) */
    public static List<String> names() {
        return Arrays.stream(Dimension.values())
                .map(Dimension::column)
                .toList();
    }
}
