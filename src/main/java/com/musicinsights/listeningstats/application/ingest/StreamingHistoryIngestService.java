package com.musicinsights.listeningstats.application.ingest;

import com.musicinsights.listeningstats.infrastructure.input.history.StreamingHistoryEntry;
import com.musicinsights.listeningstats.infrastructure.mapper.StreamingHistoryMapper;
import com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.repo.PlayRecordRepo;
import com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.row.PlayRecordRow;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 스트리밍 기록 배치를 정제하여 재생 기록 테이블에 적재하는 서비스.
 * <p>
 * 배치 하나는 하나의 리액티브 트랜잭션으로 저장된다. 실패한 배치는 통째로 롤백된다.
 */
@Service
public class StreamingHistoryIngestService {

    private final PlayRecordRepo playRecordRepo;
    private final StreamingHistoryMapper mapper;
    private final TransactionalOperator tx;

    public StreamingHistoryIngestService(
            PlayRecordRepo playRecordRepo,
            StreamingHistoryMapper mapper,
            TransactionalOperator tx
    ) {
        this.playRecordRepo = playRecordRepo;
        this.mapper = mapper;
        this.tx = tx;
    }

    /**
     * @param batch 원본 항목 배치
     * @return 삽입된 행 수 (음악 재생 항목이 없으면 0, DB 호출 없음)
     */
    public Mono<Long> ingestBatch(List<StreamingHistoryEntry> batch) {
        return Mono.fromCallable(() -> mapper.toRows(batch))
                .flatMap(rows -> rows.isEmpty()
                        ? Mono.just(0L)
                        : insert(rows));
    }

    private Mono<Long> insert(List<PlayRecordRow> rows) {
        return tx.transactional(playRecordRepo.insertAll(rows));
    }

    public Mono<Long> countRecords() {
        return playRecordRepo.countAll();
    }
}
