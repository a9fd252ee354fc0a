package com.work.bundler.web;

import com.work.bundler.config.BundlerProperties;
import com.work.bundler.service.UserOperationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运维探活：进程存活即返回 ok，并附带池与调度器的当前状态。
 */
@RestController
public class HealthController {

    private final UserOperationService service;
    private final BundlerProperties props;

    public HealthController(UserOperationService service, BundlerProperties props) {
        this.service = service;
        this.props = props;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("poolSize", service.poolSize());
        body.put("schedulerState", service.schedulerState().name());
        body.put("entryPoint", props.getEntryPointAddress());
        return body;
    }
}
