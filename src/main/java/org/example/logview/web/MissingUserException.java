package org.example.logview.web;

/**
 * 请求没有携带用户名（请求头缺失或为空）。
 */
public class MissingUserException extends RuntimeException {

    public MissingUserException(String message) {
        super(message);
    }
}
