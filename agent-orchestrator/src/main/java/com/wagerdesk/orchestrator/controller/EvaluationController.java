package com.wagerdesk.orchestrator.controller;

import com.wagerdesk.common.trace.TraceContextUtil;
import com.wagerdesk.orchestrator.logger.DecisionFlowLogger;
import com.wagerdesk.orchestrator.model.EvaluationRequest;
import com.wagerdesk.orchestrator.model.EvaluationResult;
import com.wagerdesk.orchestrator.service.EvaluationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/evaluate")
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final DecisionFlowLogger decisionFlowLogger;

    public EvaluationController(EvaluationService evaluationService, DecisionFlowLogger decisionFlowLogger) {
        this.evaluationService = evaluationService;
        this.decisionFlowLogger = decisionFlowLogger;
    }

    /**
     * Always answers 200; an evaluation that could not run reports it through
     * {@code dataQuality} and {@code errors}.
     */
    @PostMapping
    public Mono<ResponseEntity<EvaluationResult>> evaluate(
            @RequestBody EvaluationRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceIdHeader) {
        String traceId = traceIdHeader != null && !traceIdHeader.isBlank()
            ? traceIdHeader : TraceContextUtil.newTraceId();
        decisionFlowLogger.logWithTraceId(DecisionFlowLogger.REQUEST_RECEIVED, traceId);
        Mono<EvaluationResult> result = evaluationService.evaluate(request, traceId)
            .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.RESPONSE_SENT));
        return TraceContextUtil.withTraceId(result, traceId).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
