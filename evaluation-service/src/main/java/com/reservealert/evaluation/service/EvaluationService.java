package com.reservealert.evaluation.service;

import com.reservealert.common.engine.AlertDecisionEngine;
import com.reservealert.common.model.AlertRow;
import com.reservealert.evaluation.dto.EvaluationRequest;
import com.reservealert.evaluation.dto.EvaluationResponse;
import com.reservealert.evaluation.logger.EvaluationFlowLogger;
import com.reservealert.evaluation.parser.ParsedSeries;
import com.reservealert.evaluation.parser.SeriesParser;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Parses a request's series and runs it through the shared {@link AlertDecisionEngine}.
 *
 * <p>Each call gets its own {@code evaluationId} and its own engine run state; the engine bean only
 * holds the immutable rule set, so concurrent requests never interfere.
 */
@Service
public class EvaluationService {

    static final String EXAMPLE_SERIES = "92,91,90,89,88,90,91,92";

    private final AlertDecisionEngine engine;
    private final SeriesParser parser;
    private final EvaluationFlowLogger flowLogger;

    public EvaluationService(AlertDecisionEngine engine, SeriesParser parser, EvaluationFlowLogger flowLogger) {
        this.engine = engine;
        this.parser = parser;
        this.flowLogger = flowLogger;
    }

    /**
     * Evaluates one series.
     *
     * @return the rows, or an error signal carrying {@link SeriesInputException} when the text
     *         holds no integers
     */
    public Mono<EvaluationResponse> evaluate(EvaluationRequest request) {
        String evaluationId = UUID.randomUUID().toString();
        flowLogger.logWithEvaluationId(EvaluationFlowLogger.REQUEST_RECEIVED, evaluationId);

        return Mono.fromCallable(() -> run(request, evaluationId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private EvaluationResponse run(EvaluationRequest request, String evaluationId) {
        ParsedSeries series = parser.parse(request == null ? null : request.series());
        flowLogger.logParsed(series, parser.maxPoints(), evaluationId);
        if (series.isEmpty()) {
            throw new SeriesInputException("No valid integers found. Example: " + EXAMPLE_SERIES);
        }

        List<AlertRow> rows = engine.evaluate(series.values());
        flowLogger.logRows(rows, evaluationId);
        return new EvaluationResponse(evaluationId, engine.config().mode(), series.values().size(),
            series.truncated(), series.skippedTokens(), Instant.now(), rows);
    }
}
