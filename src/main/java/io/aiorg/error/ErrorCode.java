package io.aiorg.error;

import java.util.Optional;

/**
 * Stable JSON-RPC error codes. Standard codes sit in -32700..-32600, vault codes in -32001..-32010.
 */
public enum ErrorCode {
    PARSE_ERROR(-32700),
    INVALID_REQUEST(-32600),
    METHOD_NOT_FOUND(-32601),
    INVALID_PARAMS(-32602),
    INTERNAL_ERROR(-32603),

    TASK_NOT_FOUND(-32001),
    AMBIGUOUS_MATCH(-32002),
    VAULT_NOT_FOUND(-32003),
    INVALID_DATE(-32004),
    VAULT_NOT_INITIALIZED(-32005),
    PROJECT_NOT_FOUND(-32006),
    PERSON_NOT_FOUND(-32007),
    CONTEXT_PACK_NOT_FOUND(-32008),
    CONTEXT_PACK_EXISTS(-32009),
    FILE_OUTSIDE_VAULT(-32010);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isNotFound() {
        return this == TASK_NOT_FOUND
                || this == PROJECT_NOT_FOUND
                || this == PERSON_NOT_FOUND
                || this == CONTEXT_PACK_NOT_FOUND;
    }

    public static Optional<ErrorCode> fromCode(int code) {
        for (ErrorCode value : values()) {
            if (value.code == code) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
