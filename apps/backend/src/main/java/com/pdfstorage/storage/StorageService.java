package com.pdfstorage.storage;

import com.pdfstorage.session.SessionContext;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 把“上传 / 列举 / 删除”映射到用户存储仓库的 Contents API 上。
 */
public interface StorageService {

    /** 根据业务规则构建仓库内路径：{uploadFolder}/{epochMillis}-{filename} */
    String buildUploadPath(String filename);

    /** 直链：{rawBaseUrl}/{owner}/{repo}/{branch}/{path}，不需要额外请求 */
    String rawUrl(String owner, String path);

    /**
     * 校验并提交一个 PDF。无论成功、校验失败还是远端失败，临时文件都会被删除。
     */
    Mono<StoredFile> upload(SessionContext session, UploadRequest request);

    /** 列出上传目录下的文件；目录不存在时返回空列表 */
    Mono<List<StoredFile>> listFiles(SessionContext session);

    /** 先读 sha 再删除；409 冲突时按配置有限次重试 */
    Mono<DeleteResult> deleteFile(SessionContext session, String fileName);
}
