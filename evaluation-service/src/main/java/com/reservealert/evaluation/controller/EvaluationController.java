package com.reservealert.evaluation.controller;

import com.reservealert.common.config.RuleConfig;
import com.reservealert.evaluation.dto.ErrorResponse;
import com.reservealert.evaluation.dto.EvaluationRequest;
import com.reservealert.evaluation.dto.RulesResponse;
import com.reservealert.evaluation.service.EvaluationService;
import com.reservealert.evaluation.service.SeriesInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/evaluate")
public class EvaluationController {

    private static final Logger log = LoggerFactory.getLogger(EvaluationController.class);

    private final EvaluationService evaluationService;
    private final RuleConfig ruleConfig;

    public EvaluationController(EvaluationService evaluationService, RuleConfig ruleConfig) {
        this.evaluationService = evaluationService;
        this.ruleConfig = ruleConfig;
    }

    @PostMapping
    public Mono<ResponseEntity<?>> evaluate(@RequestBody EvaluationRequest request) {
        return evaluationService.evaluate(request)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(SeriesInputException.class, e -> {
                log.warn("Rejected series: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage())));
            });
    }

    @GetMapping("/rules")
    public ResponseEntity<RulesResponse> rules() {
        return ResponseEntity.ok(RulesResponse.of(ruleConfig));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
