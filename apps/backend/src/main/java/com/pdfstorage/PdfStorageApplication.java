package com.pdfstorage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class PdfStorageApplication {

    public static void main(String[] args) {
        log.info("Starting PDF storage backend");
        SpringApplication.run(PdfStorageApplication.class, args);
        log.info("PDF storage backend started");
    }

}
