package com.musicinsights.listeningstats.infrastructure.persistence.r2dbc;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.mockito.Mockito.*;

/**
 * {@link BatchSqlSupport} 단위 테스트.
 *
 * <p>DB 없이 chunk 분할/합산, 다중 행 INSERT 문 생성, null-safe 바인딩을 검증한다.</p>
 */
@DisplayName("batch sql support 테스트")
class BatchSqlSupportTest {

    static class TestSupport extends BatchSqlSupport {
        TestSupport(DatabaseClient db) { super(db); }
    }

    private final TestSupport support = new TestSupport(Mockito.mock(DatabaseClient.class));

    @DisplayName("chunkedSum에 null 또는 빈 리스트를 주면 0")
    @Test
    void chunkedSum_nullOrEmpty_returns0() {
        StepVerifier.create(support.chunkedSum(null, 3, xs -> Mono.just(1L)))
                .expectNext(0L)
                .verifyComplete();

        StepVerifier.create(support.chunkedSum(List.of(), 3, xs -> Mono.just(1L)))
                .expectNext(0L)
                .verifyComplete();
    }

    @DisplayName("chunkedSum이 chunk 단위로 순서대로 실행하고 결과를 합산")
    @Test
    void chunkedSum_splitsAndSums() {
        List<List<Integer>> received = new ArrayList<>();
        Function<List<Integer>, Mono<Long>> onceFn = chunk -> {
            received.add(List.copyOf(chunk));
            return Mono.just((long) chunk.size());
        };

        StepVerifier.create(support.chunkedSum(List.of(1, 2, 3, 4, 5), 2, onceFn))
                .expectNext(5L)
                .verifyComplete();

        Assertions.assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), received);
    }

    @DisplayName("다중 행 INSERT 문: 컬럼 순번_행 순번 파라미터")
    @Test
    void multiRowInsert_buildsNamedPlaceholders() {
        String sql = BatchSqlSupport.multiRowInsert("plays", List.of("a", "b"), 2);

        Assertions.assertEquals(
                "INSERT INTO plays (a, b) VALUES (:c0_0, :c1_0), (:c0_1, :c1_1)",
                sql);
    }

    @DisplayName("bindOrNull: null 이면 bindNull, 아니면 bind")
    @Test
    void bindOrNull_branches() {
        DatabaseClient.GenericExecuteSpec spec = mock(DatabaseClient.GenericExecuteSpec.class);
        when(spec.bind(anyString(), any())).thenReturn(spec);
        when(spec.bindNull(anyString(), any())).thenReturn(spec);

        support.bindOrNull(spec, "x", null, String.class);
        support.bindOrNull(spec, "y", "v", String.class);

        verify(spec).bindNull("x", String.class);
        verify(spec).bind("y", "v");
        verifyNoMoreInteractions(spec);
    }
}
