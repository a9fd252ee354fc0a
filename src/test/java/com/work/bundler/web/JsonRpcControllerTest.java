package com.work.bundler.web;

import com.work.bundler.BundlerHarness;
import com.work.bundler.TestOperations;
import com.work.bundler.config.BundlerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class JsonRpcControllerTest {

    private BundlerHarness harness;
    private MockMvc mvc;

    @BeforeEach
    public void setUp() {
        harness = new BundlerHarness(new BundlerProperties());
        mvc = MockMvcBuilders.standaloneSetup(
                new JsonRpcController(harness.dispatcher),
                new HealthController(harness.service, harness.props)).build();
    }

    @Test
    public void supported_entry_points_envelope() throws Exception {
        mvc.perform(post("/rpc").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jsonrpc\":\"2.0\",\"method\":\"eth_supportedEntryPoints\",\"params\":[],\"id\":7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jsonrpc").value("2.0"))
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.result[0]").value(TestOperations.ENTRY_POINT));
    }

    @Test
    public void unknown_method_is_http_400() throws Exception {
        mvc.perform(post("/rpc").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jsonrpc\":\"2.0\",\"method\":\"eth_foo\",\"params\":[],\"id\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value(-32601))
                .andExpect(jsonPath("$.error.message").value("Method not found"));
    }

    @Test
    public void missing_receipt_is_explicit_null_result() throws Exception {
        mvc.perform(post("/rpc").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jsonrpc\":\"2.0\",\"method\":\"eth_getUserOperationReceipt\",\"params\":[\"0x"
                                + "12".repeat(32) + "\"],\"id\":2}"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("\"result\":null")))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    public void unparseable_body_is_parse_error() throws Exception {
        mvc.perform(post("/rpc").contentType(MediaType.APPLICATION_JSON).content("{oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value(-32700));
    }

    @Test
    public void health_reports_pool_and_scheduler() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.poolSize").value(0))
                .andExpect(jsonPath("$.schedulerState").value("IDLE"))
                .andExpect(jsonPath("$.entryPoint").value(containsString("0x")));
    }
}
