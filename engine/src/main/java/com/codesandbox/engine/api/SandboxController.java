package com.codesandbox.engine.api;

import com.codesandbox.engine.admission.AdmissionController;
import com.codesandbox.engine.api.dto.ApiResponse;
import com.codesandbox.engine.api.dto.RunCodeData;
import com.codesandbox.engine.api.dto.RunCodeRequest;
import com.codesandbox.engine.model.ExecutionRequest;
import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.model.FailureKind;
import com.codesandbox.engine.service.ExecutionService;
import com.codesandbox.engine.service.LogPreview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP surface of the sandbox.
 *
 * POST /v1/sandbox/run  run a snippet (requires X-Api-Key)
 * GET  /health          liveness probe, always "ok"
 *
 * Example:
 *   curl -X POST http://localhost:8194/v1/sandbox/run \
 *     -H "X-Api-Key: dify-sandbox" -H "Content-Type: application/json" \
 *     -d '{"language":"python3","code":"print(1 + 1)"}'
 */
@RestController
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final ExecutionService    executionService;
    private final AdmissionController admission;

    public SandboxController(ExecutionService executionService, AdmissionController admission) {
        this.executionService = executionService;
        this.admission        = admission;
    }

    /**
     * Admission happens on the servlet thread, so an overloaded service
     * answers 503 immediately. The run itself completes on an admission
     * thread and the servlet thread is released meanwhile.
     */
    @PostMapping("/v1/sandbox/run")
    public CompletableFuture<ApiResponse<RunCodeData>> run(@RequestBody RunCodeRequest req) {
        // Blank tags are left to the coordinator, which answers "unsupported language".
        if (req.language() == null) {
            throw new InvalidRequestException("language is required");
        }
        if (req.code() == null) {
            throw new InvalidRequestException("code is required");
        }
        log.debug("Run request: language={} code={}", req.language(), LogPreview.truncate(req.code()));

        ExecutionRequest request = new ExecutionRequest(req.language(), req.code(), req.preload(),
                Boolean.TRUE.equals(req.enableNetwork()));
        return admission.submit(() -> executionService.execute(request))
                .thenApply(SandboxController::toResponse);
    }

    @GetMapping("/health")
    public String health() {
        return "ok";
    }

    static ApiResponse<RunCodeData> toResponse(ExecutionResult result) {
        if (result.failure() == FailureKind.UNSUPPORTED_LANGUAGE) {
            return ApiResponse.error(-400, "unsupported language");
        }
        return ApiResponse.success(RunCodeData.from(result));
    }
}
