package com.musicinsights.listeningstats.application.aggregate.dimension;

/**
 * 집계 차원 값의 타입.
 */
public enum DimensionType {
    STRING {
        @Override
        public Object parse(String raw) {
            return raw;
        }
    },
    INTEGER {
        @Override
        public Object parse(String raw) {
            return Integer.valueOf(raw);
        }
    };

    /**
     * 외부(쿼리스트링) 문자열 값을 바인딩 가능한 값으로 변환한다.
     *
     * @param raw trim 된 원본 값
     * @return 바인딩 값
     * @throws NumberFormatException INTEGER 타입인데 정수가 아닌 경우
     */
    public abstract Object parse(String raw);
}
