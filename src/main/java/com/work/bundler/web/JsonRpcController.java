package com.work.bundler.web;

import com.work.bundler.web.dto.JsonRpcRequest;
import com.work.bundler.web.dto.JsonRpcResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON-RPC 入口：POST /rpc（也接受 POST /，兼容直接把节点地址配置为 bundler 的客户端）。
 *
 * HTTP 状态码跟随错误类型：成功 200，请求错误 400，执行错误 500。
 */
@RestController
public class JsonRpcController {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcController.class);

    private final JsonRpcDispatcher dispatcher;

    public JsonRpcController(JsonRpcDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping({"/rpc", "/"})
    public ResponseEntity<JsonRpcResponse> handle(@RequestBody JsonRpcRequest request) {
        JsonRpcResponse response = dispatcher.dispatch(request);
        return ResponseEntity.status(response.getHttpStatus()).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<JsonRpcResponse> unreadable(HttpMessageNotReadableException e) {
        log.debug("rpc body not readable err={}", e.getMessage());
        JsonRpcResponse response = JsonRpcResponse.failure(null, RpcException.PARSE_ERROR, "Parse error", 400);
        return ResponseEntity.status(response.getHttpStatus()).body(response);
    }
}
