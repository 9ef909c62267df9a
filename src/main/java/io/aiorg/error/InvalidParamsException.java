package io.aiorg.error;

public class InvalidParamsException extends AiorgException {
    public InvalidParamsException(String message) {
        super(ErrorCode.INVALID_PARAMS, message);
    }
}
