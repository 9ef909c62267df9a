package io.aiorg.error;

public class VaultNotInitializedException extends AiorgException {
    public VaultNotInitializedException(String message) {
        super(ErrorCode.VAULT_NOT_INITIALIZED, message);
    }
}
