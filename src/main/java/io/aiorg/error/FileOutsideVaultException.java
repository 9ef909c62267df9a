package io.aiorg.error;

public class FileOutsideVaultException extends AiorgException {
    public FileOutsideVaultException(String path) {
        super(ErrorCode.FILE_OUTSIDE_VAULT, "Path is outside the vault: " + path);
    }
}
