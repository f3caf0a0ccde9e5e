package com.causescore.api.controller;

import com.causescore.api.dto.EvaluateCausesRequest;
import com.causescore.api.dto.EvaluateProjectsRequest;
import com.causescore.evaluation.CauseEvaluationRequest;
import com.causescore.evaluation.EvaluationOrchestrator;
import com.causescore.evaluation.EvaluationResult;
import com.causescore.evaluation.MultiCauseEvaluationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST /evaluate/cause and /evaluate/causes. Evaluation blocks on LLM and Mongo calls, so it runs off the event loop.
 */
@RestController
@RequestMapping("/api/v1/evaluate")
@RequiredArgsConstructor
@Slf4j
public class EvaluationController {

    private final EvaluationOrchestrator orchestrator;

    @PostMapping("/cause")
    public Mono<ResponseEntity<EvaluationResult>> evaluateCause(@Valid @RequestBody EvaluateProjectsRequest request) {
        CauseEvaluationRequest evaluation = request.toEvaluationRequest();
        return Mono.fromCallable(() -> orchestrator.evaluate(evaluation.cause(), evaluation.projectIds(), request.highestPowerRank()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/causes")
    public Mono<ResponseEntity<MultiCauseEvaluationResult>> evaluateCauses(@Valid @RequestBody EvaluateCausesRequest request) {
        List<CauseEvaluationRequest> evaluations = request.causes().stream()
                .map(EvaluateProjectsRequest::toEvaluationRequest)
                .toList();
        log.info("Batch evaluation requested for {} causes", evaluations.size());
        return Mono.fromCallable(() -> orchestrator.evaluateMany(evaluations, request.highestPowerRank()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
