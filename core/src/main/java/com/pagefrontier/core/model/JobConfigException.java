package com.pagefrontier.core.model;

/** 잘못된 작업 설정. 크롤 시작 전에 호출자에게 그대로 전달된다. */
public class JobConfigException extends IllegalArgumentException {
    public JobConfigException(String message) {
        super(message);
    }

    public JobConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
