package com.work.bundler.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.work.bundler.core.exception.OperationRejectedException;
import com.work.bundler.core.model.UserOperation;
import com.work.bundler.service.UserOperationService;
import com.work.bundler.web.dto.JsonRpcRequest;
import com.work.bundler.web.dto.JsonRpcResponse;
import com.work.bundler.web.dto.UserOperationDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 无状态分发：方法名 -> UserOperationService，内部结果/异常映射为 JSON-RPC 响应。
 *
 * 错误码：
 * -32600 信封不完整；-32601 未知方法；-32602 参数错误；
 * -32500 被 EntryPoint 拒绝（含 entryPoint 不匹配）；-32603 其他内部错误（只带 message，不带堆栈）。
 */
public class JsonRpcDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcDispatcher.class);

    @FunctionalInterface
    interface RpcMethod {
        Object invoke(JsonNode params) throws Exception;
    }

    private final ObjectMapper objectMapper;
    private final Map<String, RpcMethod> methods = new LinkedHashMap<>();

    public JsonRpcDispatcher(UserOperationService service, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        methods.put("eth_sendUserOperation",
                params -> service.sendUserOperation(operation(params, 0), text(params, 1, "entryPoint")));
        methods.put("eth_estimateUserOperationGas",
                params -> service.estimateUserOperationGas(operation(params, 0), text(params, 1, "entryPoint")).toHex());
        methods.put("eth_getUserOperationReceipt",
                params -> service.getUserOperationReceipt(text(params, 0, "userOpHash")));
        methods.put("eth_supportedEntryPoints",
                params -> service.supportedEntryPoints());
    }

    public Set<String> methodNames() {
        return Collections.unmodifiableSet(methods.keySet());
    }

    public JsonRpcResponse dispatch(JsonRpcRequest request) {
        JsonNode id = request == null ? null : request.getId();
        if (request == null || request.getMethod() == null || request.getMethod().trim().isEmpty()) {
            return JsonRpcResponse.failure(id, RpcException.INVALID_REQUEST, "Invalid request", 400);
        }
        RpcMethod method = methods.get(request.getMethod());
        if (method == null) {
            return JsonRpcResponse.failure(id, RpcException.METHOD_NOT_FOUND, "Method not found", 400);
        }
        try {
            return JsonRpcResponse.success(id, method.invoke(params(request)));
        } catch (RpcException e) {
            return JsonRpcResponse.failure(id, e.getCode(), e.getMessage(), e.httpStatus());
        } catch (OperationRejectedException e) {
            return JsonRpcResponse.failure(id, RpcException.REJECTED_BY_ENTRY_POINT, e.getMessage(), 500);
        } catch (Exception e) {
            log.warn("rpc internal error method={} err={}", request.getMethod(), e.toString());
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return JsonRpcResponse.failure(id, RpcException.INTERNAL_ERROR, message, 500);
        }
    }

    private static JsonNode params(JsonRpcRequest request) {
        JsonNode params = request.getParams();
        if (params == null || params.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!params.isArray()) {
            throw new RpcException(RpcException.INVALID_PARAMS, "params must be an array");
        }
        return params;
    }

    private UserOperation operation(JsonNode params, int index) {
        JsonNode node = params.get(index);
        if (node == null || !node.isObject()) {
            throw new RpcException(RpcException.INVALID_PARAMS, "missing UserOperation at params[" + index + "]");
        }
        try {
            return objectMapper.treeToValue(node, UserOperationDto.class).toOperation();
        } catch (JsonProcessingException e) {
            throw new RpcException(RpcException.INVALID_PARAMS, "malformed UserOperation: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcException.INVALID_PARAMS, e.getMessage(), e);
        }
    }

    private static String text(JsonNode params, int index, String name) {
        JsonNode node = params.get(index);
        if (node == null || !node.isTextual()) {
            throw new RpcException(RpcException.INVALID_PARAMS, "missing " + name + " at params[" + index + "]");
        }
        return node.asText();
    }
}
