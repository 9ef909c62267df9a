package io.aiorg.error;

public class ContextPackNotFoundException extends AiorgException {
    public ContextPackNotFoundException(String message) {
        super(ErrorCode.CONTEXT_PACK_NOT_FOUND, message);
    }
}
