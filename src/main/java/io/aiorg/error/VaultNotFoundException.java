package io.aiorg.error;

public class VaultNotFoundException extends AiorgException {
    public VaultNotFoundException(String message) {
        super(ErrorCode.VAULT_NOT_FOUND, message);
    }
}
