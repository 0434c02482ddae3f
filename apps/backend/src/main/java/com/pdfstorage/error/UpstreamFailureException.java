package com.pdfstorage.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 远端调用失败（含冲突）。reason 是给客户端的通用文案，细节只留在 cause 和服务端日志里。
 */
public class UpstreamFailureException extends ResponseStatusException {

    public UpstreamFailureException(String reason, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, reason, cause);
    }
}
