package com.musicinsights.listeningstats.application.aggregate.dimension;

import com.musicinsights.listeningstats.application.common.error.InvalidDimensionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("dimension registry 테스트")
class DimensionRegistryTest {

    @Test
    @DisplayName("허용된 7개 컬럼만 유효하다")
    void isValidDimension_onlyAllowList() {
        assertThat(DimensionRegistry.names()).containsExactly(
                "artist_name", "track_name", "album_name", "year", "month", "day_of_week", "hour");

        DimensionRegistry.names().forEach(n -> assertThat(DimensionRegistry.isValidDimension(n)).isTrue());

        assertThat(DimensionRegistry.isValidDimension("minutes_played")).isFalse();
        assertThat(DimensionRegistry.isValidDimension("artist_name; DROP TABLE x")).isFalse();
        assertThat(DimensionRegistry.isValidDimension("ARTIST_NAME")).isFalse();
        assertThat(DimensionRegistry.isValidDimension(null)).isFalse();
    }

    @Test
    @DisplayName("typeOf: 정수/문자열 타입 구분, 모르는 이름은 InvalidDimensionException")
    void typeOf() {
        assertThat(DimensionRegistry.typeOf("year")).isEqualTo(DimensionType.INTEGER);
        assertThat(DimensionRegistry.typeOf("month")).isEqualTo(DimensionType.INTEGER);
        assertThat(DimensionRegistry.typeOf("hour")).isEqualTo(DimensionType.INTEGER);
        assertThat(DimensionRegistry.typeOf("day_of_week")).isEqualTo(DimensionType.STRING);
        assertThat(DimensionRegistry.typeOf("artist_name")).isEqualTo(DimensionType.STRING);

        assertThatThrownBy(() -> DimensionRegistry.typeOf("genre"))
                .isInstanceOf(InvalidDimensionException.class)
                .hasMessageContaining("genre");
    }

    @Test
    @DisplayName("필터 키는 컬럼명과 복수형 별칭 모두 허용")
    void findByFilterKey_acceptsColumnAndAlias() {
        assertThat(DimensionRegistry.findByFilterKey("artists")).contains(Dimension.ARTIST_NAME);
        assertThat(DimensionRegistry.findByFilterKey("artist_name")).contains(Dimension.ARTIST_NAME);
        assertThat(DimensionRegistry.findByFilterKey("days")).contains(Dimension.DAY_OF_WEEK);
        assertThat(DimensionRegistry.findByFilterKey("hours")).contains(Dimension.HOUR);
        assertThat(DimensionRegistry.findByFilterKey("genres")).isEmpty();

        // group by 에는 별칭을 쓸 수 없다
        assertThat(DimensionRegistry.find("artists")).isEmpty();
    }

    @Test
    @DisplayName("INTEGER 파싱 실패 시 NumberFormatException")
    void integerParse() {
        assertThat(DimensionType.INTEGER.parse("2020")).isEqualTo(2020);
        assertThat(DimensionType.STRING.parse("Monday")).isEqualTo("Monday");
        assertThatThrownBy(() -> DimensionType.INTEGER.parse("abc"))
                .isInstanceOf(NumberFormatException.class);
    }
}
