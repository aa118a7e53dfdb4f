package com.musicinsights.listeningstats.application.aggregate.dimension;

/**
 * group by / filter 에 사용할 수 있는 재생 기록 컬럼.
 *
 * <p>column 값은 SQL 본문에 직접 들어가는 유일한 식별자이므로 여기 선언된 것 외에는 허용하지 않는다.</p>
 */
public enum Dimension {
    ARTIST_NAME("artist_name", DimensionType.STRING, "artists"),
    TRACK_NAME("track_name", DimensionType.STRING, "tracks"),
    ALBUM_NAME("album_name", DimensionType.STRING, "albums"),
    YEAR("year", DimensionType.INTEGER, "years"),
    MONTH("month", DimensionType.INTEGER, "months"),
    DAY_OF_WEEK("day_of_week", DimensionType.STRING, "days"),
    HOUR("hour", DimensionType.INTEGER, "hours");

    private final String column;
    private final DimensionType type;
    private final String filterAlias;

    Dimension(String column, DimensionType type, String filterAlias) {
        this.column = column;
        this.type = type;
        this.filterAlias = filterAlias;
    }

    /** 테이블 컬럼명(= 응답 키) */
    public String column() {
        return column;
    }

    public DimensionType type() {
        return type;
    }

    /** filter_ 쿼리 파라미터용 복수형 별칭 (예: filter_artists) */
    public String filterAlias() {
        return filterAlias;
    }
}
