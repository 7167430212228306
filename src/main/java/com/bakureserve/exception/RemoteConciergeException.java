package com.bakureserve.exception;

/**
 * 원격 랭킹 호출 실패 (네트워크 오류, 2xx 이외 응답, 잘못된 페이로드)
 */
public class RemoteConciergeException extends RuntimeException {

    public RemoteConciergeException(String message) {
        super(message);
    }

    public RemoteConciergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
