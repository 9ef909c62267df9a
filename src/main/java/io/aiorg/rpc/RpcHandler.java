package io.aiorg.rpc;

@FunctionalInterface
public interface RpcHandler {
    Object handle(HandlerContext ctx, Params params);
}
