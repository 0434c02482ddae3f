package com.pdfstorage.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "storage.github")
public class StorageProps {

    /** 每个用户名下固定一个存储仓库 */
    private String repoName = "pdf-storage";
    private String repoDescription = "My personal PDF storage";
    private boolean privateRepo = false;

    /** 上传文件统一放在这个目录下 */
    private String uploadFolder = "uploads";
    private String branch = "main";

    /** 直链基址：{rawBaseUrl}/{owner}/{repo}/{branch}/{path} */
    private String rawBaseUrl = "https://raw.githubusercontent.com";

    /** GitHub 单文件硬上限 100 MiB */
    private long maxFileSizeBytes = 100L * 1024 * 1024;

    /** 删除遇到 409 冲突时，读 sha + 删除 这一组最多尝试几次 */
    private int deleteMaxAttempts = 3;

    /** 上传临时文件目录，为空时用系统临时目录 */
    private String tempDir;
}
