package io.aiorg.error;

public class ContextPackExistsException extends AiorgException {
    public ContextPackExistsException(String message) {
        super(ErrorCode.CONTEXT_PACK_EXISTS, message);
    }
}
