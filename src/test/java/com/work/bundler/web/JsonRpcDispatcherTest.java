package com.work.bundler.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.bundler.BundlerHarness;
import com.work.bundler.TestOperations;
import com.work.bundler.config.BundlerProperties;
import com.work.bundler.service.UserOperationService;
import com.work.bundler.web.dto.JsonRpcRequest;
import com.work.bundler.web.dto.JsonRpcResponse;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class JsonRpcDispatcherTest {

    private final BundlerProperties props = new BundlerProperties();
    private final BundlerHarness harness = new BundlerHarness(props);

    private JsonRpcRequest request(String method, JsonNode params) {
        JsonRpcRequest req = new JsonRpcRequest();
        req.setJsonrpc("2.0");
        req.setMethod(method);
        req.setParams(params);
        req.setId(IntNode.valueOf(1));
        return req;
    }

    private ObjectNode operationJson(String sender, String nonce, String signature) {
        ObjectNode op = harness.objectMapper.createObjectNode();
        op.put("sender", sender);
        op.put("nonce", nonce);
        op.put("initCode", "0x");
        op.put("callData", "0xb61d27f6");
        op.put("callGasLimit", "0x186a0");
        op.put("verificationGasLimit", "0x249f0");
        op.put("preVerificationGas", "0xc350");
        op.put("maxFeePerGas", "0x77359400");
        op.put("maxPriorityFeePerGas", "0x3b9aca00");
        op.put("paymasterAndData", "0x");
        op.put("signature", signature);
        return op;
    }

    private ArrayNode params(Object... values) {
        ArrayNode array = harness.objectMapper.createArrayNode();
        for (Object v : values) {
            if (v instanceof JsonNode) {
                array.add((JsonNode) v);
            } else {
                array.add(String.valueOf(v));
            }
        }
        return array;
    }

    private static JsonRpcResponse.Failure failure(JsonRpcResponse resp) {
        assertTrue(resp instanceof JsonRpcResponse.Failure, "expected error response");
        return (JsonRpcResponse.Failure) resp;
    }

    @Test
    public void method_table_exposes_the_four_bundler_methods() {
        assertEquals(new HashSet<>(Arrays.asList("eth_sendUserOperation", "eth_estimateUserOperationGas",
                "eth_getUserOperationReceipt", "eth_supportedEntryPoints")), harness.dispatcher.methodNames());
    }

    @Test
    public void send_user_operation_returns_hash_and_admits() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_sendUserOperation",
                params(operationJson(TestOperations.SENDER_A, "0x0", "0x1234"), TestOperations.ENTRY_POINT)));

        assertTrue(resp instanceof JsonRpcResponse.Success);
        String hash = (String) ((JsonRpcResponse.Success) resp).getResult();
        assertTrue(harness.pool.contains(hash));
        assertEquals(200, resp.getHttpStatus());
        assertEquals(1, resp.getId().asInt());
    }

    @Test
    public void wrong_entry_point_is_rejected_before_pool() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_sendUserOperation",
                params(operationJson(TestOperations.SENDER_A, "0x0", "0x1234"), TestOperations.OTHER_ENTRY_POINT)));

        JsonRpcResponse.Failure f = failure(resp);
        assertEquals(RpcException.REJECTED_BY_ENTRY_POINT, f.getError().getCode());
        assertTrue(f.getError().getMessage().contains("Invalid entry point"));
        assertEquals(0, harness.pool.size());
    }

    @Test
    public void failed_validation_maps_to_rejection_code() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_sendUserOperation",
                params(operationJson(TestOperations.SENDER_A, "0x0", "0x"), TestOperations.ENTRY_POINT)));

        JsonRpcResponse.Failure f = failure(resp);
        assertEquals(RpcException.REJECTED_BY_ENTRY_POINT, f.getError().getCode());
        assertEquals("User operation validation failed", f.getError().getMessage());
        assertEquals(500, resp.getHttpStatus());
    }

    @Test
    public void unknown_method_is_method_not_found() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_chainId", params()));

        JsonRpcResponse.Failure f = failure(resp);
        assertEquals(-32601, f.getError().getCode());
        assertEquals("Method not found", f.getError().getMessage());
        assertEquals(400, resp.getHttpStatus());
    }

    @Test
    public void malformed_operation_is_invalid_params() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_sendUserOperation",
                params(operationJson("0x1234", "0x0", "0x1234"), TestOperations.ENTRY_POINT)));

        assertEquals(RpcException.INVALID_PARAMS, failure(resp).getError().getCode());
        assertEquals(400, resp.getHttpStatus());
    }

    @Test
    public void internal_argument_error_is_internal_error() {
        UserOperationService service = mock(UserOperationService.class);
        when(service.supportedEntryPoints()).thenThrow(new IllegalArgumentException("ttl must be positive"));
        JsonRpcDispatcher dispatcher = new JsonRpcDispatcher(service, harness.objectMapper);

        JsonRpcResponse resp = dispatcher.dispatch(request("eth_supportedEntryPoints", params()));

        JsonRpcResponse.Failure f = failure(resp);
        assertEquals(RpcException.INTERNAL_ERROR, f.getError().getCode());
        assertEquals("ttl must be positive", f.getError().getMessage());
        assertEquals(500, resp.getHttpStatus());
    }

    @Test
    public void missing_method_is_invalid_request() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request(null, params()));

        assertEquals(RpcException.INVALID_REQUEST, failure(resp).getError().getCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void estimate_returns_hex_quantities() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_estimateUserOperationGas",
                params(operationJson(TestOperations.SENDER_A, "0x0", "0x1234"), TestOperations.ENTRY_POINT)));

        Map<String, String> result = (Map<String, String>) ((JsonRpcResponse.Success) resp).getResult();
        // mock 链：21000 + 50000 * 1
        assertEquals("0x11558", result.get("callGasLimit"));
        assertEquals("0x1a004", result.get("verificationGasLimit"));
        assertEquals("0xc350", result.get("preVerificationGas"));
    }

    @Test
    public void receipt_for_unknown_hash_is_null_result() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_getUserOperationReceipt",
                params("0x" + "77".repeat(32))));

        assertTrue(resp instanceof JsonRpcResponse.Success);
        assertNull(((JsonRpcResponse.Success) resp).getResult());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void supported_entry_points_returns_configured_address() {
        JsonRpcResponse resp = harness.dispatcher.dispatch(request("eth_supportedEntryPoints", null));

        List<String> result = (List<String>) ((JsonRpcResponse.Success) resp).getResult();
        assertEquals(1, result.size());
        assertTrue(result.get(0).equalsIgnoreCase(TestOperations.ENTRY_POINT));
    }
}
