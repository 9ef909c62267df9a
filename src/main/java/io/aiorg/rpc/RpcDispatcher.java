package io.aiorg.rpc;

import io.aiorg.error.AiorgException;
import io.aiorg.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes a decoded request to its handler and turns every outcome into a response. Stateless
 * between calls; safe to share across transport threads.
 */
public final class RpcDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RpcDispatcher.class);
    static final String INTERNAL_MESSAGE = "Internal error";

    private final HandlerContext context;
    private final Map<RpcMethod, RpcHandler> handlers;

    public RpcDispatcher(HandlerContext context) {
        this(context, defaultHandlers());
    }

    RpcDispatcher(HandlerContext context, Map<RpcMethod, RpcHandler> handlers) {
        this.context = context;
        this.handlers = new EnumMap<>(RpcMethod.class);
        this.handlers.putAll(Objects.requireNonNull(handlers, "handlers"));
    }

    private static Map<RpcMethod, RpcHandler> defaultHandlers() {
        Map<RpcMethod, RpcHandler> out = new EnumMap<>(RpcMethod.class);
        for (RpcMethod m : RpcMethod.values()) {
            out.put(m, m.handler());
        }
        return out;
    }

    public RpcResponse dispatch(RpcRequest request) {
        Optional<RpcMethod> method = RpcMethod.fromWire(request.method());
        RpcHandler handler = method.map(handlers::get).orElse(null);
        if (handler == null) {
            return RpcResponse.failure(request.id(), ErrorCode.METHOD_NOT_FOUND,
                    "Method not found: " + request.method());
        }
        try {
            Object result = handler.handle(context, new Params(request.params()));
            return RpcResponse.success(request.id(), result);
        } catch (AiorgException e) {
            log.debug("{} failed: {}", request.method(), e.toString());
            Object data = e.details().isEmpty() ? null : e.details();
            return RpcResponse.failure(request.id(), new RpcError(e.code().code(), e.getMessage(), data));
        } catch (RuntimeException e) {
            log.error("{} failed with an internal error", request.method(), e);
            return RpcResponse.failure(request.id(), ErrorCode.INTERNAL_ERROR, INTERNAL_MESSAGE);
        }
    }

    public byte[] handle(byte[] message) {
        RpcResponse response;
        try {
            response = dispatch(RpcCodec.decode(message));
        } catch (RpcProtocolException e) {
            log.debug("Rejected message: {}", e.getMessage());
            response = e.toResponse();
        }
        try {
            return RpcCodec.encode(response);
        } catch (RuntimeException e) {
            log.error("Failed to encode response for id {}", response.id(), e);
            return RpcCodec.encode(RpcResponse.failure(response.id(), ErrorCode.INTERNAL_ERROR, INTERNAL_MESSAGE));
        }
    }

    public HandlerContext context() {
        return context;
    }
}
