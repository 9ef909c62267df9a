package io.aiorg.rpc;

import java.util.Map;

/** Dispatchers with stand-in handlers, for transport tests outside this package. */
public final class TestDispatchers {
    private TestDispatchers() {
    }

    public static RpcDispatcher with(RpcMethod method, RpcHandler handler) {
        return new RpcDispatcher(null, Map.of(method, handler));
    }
}
