package net.cadence.core.service;

/** 기동 시 잡 저장소에 접근할 수 없음. 엔진은 시작하지 않는다 */
public class JobStoreUnavailableException extends RuntimeException {
    public JobStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
