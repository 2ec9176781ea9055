package tech.noetzold.trust_engine_api.exception;

public class StatusConflictException extends RuntimeException {
    public StatusConflictException(String message) {
        super(message);
    }
}
