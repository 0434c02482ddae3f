package com.pdfstorage.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把 multipart 文件段落盘成临时文件，得到 {@link UploadRequest}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TempFileStager {

    private final StorageProps props;

    public Mono<UploadRequest> stage(FilePart part) {
        MediaType ct = part.headers().getContentType();
        String contentType = ct != null ? ct.toString() : null;

        return Mono.fromCallable(this::createTempFile)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(tmp -> part.transferTo(tmp)
                        .then(Mono.fromCallable(() ->
                                        new UploadRequest(part.filename(), contentType, Files.size(tmp), tmp))
                                .subscribeOn(Schedulers.boundedElastic()))
                        .onErrorResume(ex -> {
                            deleteQuietly(tmp);
                            return Mono.error(ex);
                        }));
    }

    private Path createTempFile() throws IOException {
        if (StringUtils.hasText(props.getTempDir())) {
            Path dir = Files.createDirectories(Path.of(props.getTempDir()));
            return Files.createTempFile(dir, "upload-", ".tmp");
        }
        return Files.createTempFile("upload-", ".tmp");
    }

    static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[upload] failed to delete temp file {}: {}", file, e.getMessage());
        }
    }
}
