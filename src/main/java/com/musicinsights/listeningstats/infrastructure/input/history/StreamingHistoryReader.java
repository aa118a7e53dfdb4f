package com.musicinsights.listeningstats.infrastructure.input.history;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 디렉터리 안의 스트리밍 기록 JSON 파일을 읽어 {@link StreamingHistoryEntry}로 방출한다.
 * <p>
 * 각 파일은 항목 배열(일반적인 export 형태) 또는 단일 객체일 수 있다.
 * 파일 단위로 순차 처리하며, 파일 I/O는 blocking 이므로 {@link Schedulers#boundedElastic()}에서 실행한다.
 */
@Component
public class StreamingHistoryReader {

    private static final String JSON_GLOB = "*.json";

    private final ObjectMapper mapper;

    public StreamingHistoryReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 디렉터리의 모든 *.json 파일(이름순)을 읽는다.
     *
     * @param dir 입력 디렉터리
     * @return 전체 항목 스트림
     * @throws IllegalStateException 디렉터리가 없거나 JSON 파일이 없을 때(에러 시그널)
     */
    public Flux<StreamingHistoryEntry> readEntries(Path dir) {
        return Flux.defer(() -> Flux.fromIterable(listJsonFiles(dir)))
                .concatMap(file -> Mono.fromCallable(() -> readFile(file)).flatMapIterable(list -> list))
                .subscribeOn(Schedulers.boundedElastic());
    }

    List<Path> listJsonFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new IllegalStateException("Input directory not found: " + dir);
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, JSON_GLOB)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }

        if (files.isEmpty()) {
            throw new IllegalStateException("No JSON files found in " + dir);
        }
        files.sort(null);
        return files;
    }

    private List<StreamingHistoryEntry> readFile(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode root = mapper.readTree(in);

            List<StreamingHistoryEntry> entries = new ArrayList<>();
            if (root.isArray()) {
                for (int i = 0; i < root.size(); i++) {
                    entries.add(mapper.treeToValue(root.get(i), StreamingHistoryEntry.class));
                }
            } else if (root.isObject()) {
                entries.add(mapper.treeToValue(root, StreamingHistoryEntry.class));
            }
            return entries;
        }
    }
}
