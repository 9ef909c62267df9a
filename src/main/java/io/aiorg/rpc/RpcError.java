package io.aiorg.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.aiorg.error.ErrorCode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcError(int code, String message, Object data) {

    public static RpcError of(ErrorCode code, String message) {
        return new RpcError(code.code(), message, null);
    }
}
