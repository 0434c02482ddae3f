package com.pdfstorage.controller;

import com.pdfstorage.api.dto.DeleteFileRequest;
import com.pdfstorage.api.dto.DeleteFileResponse;
import com.pdfstorage.api.dto.FileEntryResponse;
import com.pdfstorage.api.dto.UploadFileResponse;
import com.pdfstorage.auth.AuthGate;
import com.pdfstorage.error.ValidationException;
import com.pdfstorage.storage.StorageService;
import com.pdfstorage.storage.TempFileStager;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
public class FileController {

    private final AuthGate authGate;
    private final StorageService storageService;
    private final TempFileStager stager;

    /**
     * 上传单个 PDF 到用户的存储仓库
     *
     * 表单字段：
     * - pdf: 文件本体（必填，application/pdf，最大 100MB）
     */
    @Operation(summary = "上传 PDF 到 GitHub 存储仓库")
    @PostMapping(value = "/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UploadFileResponse> upload(@RequestPart(value = "pdf", required = false) Mono<FilePart> pdf,
                                           WebSession session) {
        return authGate.require(session)
                .flatMap(ctx -> pdf
                        .switchIfEmpty(Mono.error(() -> new ValidationException("No file uploaded")))
                        .flatMap(stager::stage)
                        // 超过 multipart 落盘上限时，和服务层的大小校验返回同样的 400
                        .onErrorMap(DataBufferLimitException.class,
                                ex -> new ValidationException("File too large (max 100MB)"))
                        .flatMap(req -> storageService.upload(ctx, req)))
                .map(file -> new UploadFileResponse(true, file.downloadUrl()));
    }

    @Operation(summary = "列出已上传的文件")
    @GetMapping(value = "/files", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<FileEntryResponse>> files(WebSession session) {
        return authGate.require(session)
                .flatMap(storageService::listFiles)
                .map(files -> files.stream()
                        .map(f -> new FileEntryResponse(f.name(), f.path(), f.downloadUrl()))
                        .toList());
    }

    @Operation(summary = "按文件名删除")
    @PutMapping(value = "/delete", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DeleteFileResponse> delete(@RequestBody(required = false) Mono<DeleteFileRequest> body,
                                           WebSession session) {
        return authGate.require(session)
                .flatMap(ctx -> body
                        .mapNotNull(DeleteFileRequest::fileName)
                        .defaultIfEmpty("")
                        .flatMap(fileName -> storageService.deleteFile(ctx, fileName)))
                .map(result -> new DeleteFileResponse(true, result.fileName(), result.commit()));
    }
}
