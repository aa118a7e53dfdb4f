package com.musicinsights.listeningstats.bootstrap;

import com.musicinsights.listeningstats.application.common.config.ListeningStatsProperties;
import com.musicinsights.listeningstats.application.ingest.StreamingHistoryIngestService;
import com.musicinsights.listeningstats.infrastructure.input.history.StreamingHistoryReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 스트리밍 기록 JSON 파일을 배치로 DB에 적재하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code ingest}일 때만 활성화된다.</p>
 * <p>흐름: 디렉터리의 JSON 파일 읽기 → batchSize 만큼 버퍼링 → 배치 정제/적재 → 전체 건수 확인</p>
 */
@Component
@Profile("ingest")
public class StreamingHistoryIngestRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(StreamingHistoryIngestRunner.class);

    private final StreamingHistoryReader reader;
    private final StreamingHistoryIngestService ingestService;
    private final ListeningStatsProperties properties;

    public StreamingHistoryIngestRunner(
            StreamingHistoryReader reader,
            StreamingHistoryIngestService ingestService,
            ListeningStatsProperties properties
    ) {
        this.reader = reader;
        this.ingestService = ingestService;
        this.properties = properties;
    }

    /**
     * 입력 디렉터리 전체를 적재하고, 끝날 때까지 {@code block()}으로 대기한다.
     *
     * @param args 커맨드라인 인자(사용하지 않음)
     */
    @Override
    public void run(String... args) {
        Path inputDir = Path.of(properties.ingest().inputDir());
        int batchSize = properties.ingest().batchSize();
        AtomicLong inserted = new AtomicLong();

        log.info("Ingest started. inputDir={}, batchSize={}", inputDir.toAbsolutePath(), batchSize);

        reader.readEntries(inputDir)
                .buffer(batchSize)
                .concatMap(ingestService::ingestBatch)
                .doOnNext(n -> log.info("Batch done. inserted={}, total={}", n, inserted.addAndGet(n)))
                .then(Mono.defer(ingestService::countRecords))
                .doOnNext(count -> log.info("Ingest finished. inserted={}, rows in {}={}",
                        inserted.get(), properties.table(), count))
                .doOnError(e -> log.error("Ingest failed after {} rows", inserted.get(), e))
                .block();
    }
}
