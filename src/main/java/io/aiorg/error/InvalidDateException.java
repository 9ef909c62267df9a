package io.aiorg.error;

public class InvalidDateException extends AiorgException {
    public InvalidDateException(String message) {
        super(ErrorCode.INVALID_DATE, message);
    }
}
