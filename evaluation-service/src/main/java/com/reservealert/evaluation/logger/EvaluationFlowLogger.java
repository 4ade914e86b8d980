package com.reservealert.evaluation.logger;

import com.reservealert.common.model.AlertRow;
import com.reservealert.evaluation.parser.ParsedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs the lifecycle of one evaluation request. Pure side effects, no influence on the rows.
 *
 * <p>Lifecycle stages (in order), each logged once per request:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED} request accepted by the service</li>
 *   <li>{@link #SERIES_PARSED}    series text turned into integer samples</li>
 *   <li>{@link #SERIES_TRUNCATED} input exceeded {@code max-points}; only logged when it happens</li>
 *   <li>{@link #ROWS_EMITTED}     engine returned one row per sample</li>
 * </ol>
 *
 * <p>The {@code evaluationId} is put into MDC only for the duration of a log call and removed
 * afterwards, so pooled scheduler threads never carry a stale id.
 */
@Component
public class EvaluationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(EvaluationFlowLogger.class);

    public static final String EVALUATION_ID_KEY = "evaluationId";

    public static final String REQUEST_RECEIVED = "REQUEST_RECEIVED";
    public static final String SERIES_PARSED    = "SERIES_PARSED";
    public static final String SERIES_TRUNCATED = "SERIES_TRUNCATED";
    public static final String ROWS_EMITTED     = "ROWS_EMITTED";

    public void logWithEvaluationId(String stageName, String evaluationId) {
        withMdc(evaluationId, () ->
            log.info("[EvaluationFlow] stage={} evaluationId={}", stageName, evaluationId)
        );
    }

    /**
     * Logs the parse summary, plus a {@link #SERIES_TRUNCATED} warning when samples were dropped.
     */
    public void logParsed(ParsedSeries series, int maxPoints, String evaluationId) {
        withMdc(evaluationId, () -> {
            log.info("[EvaluationFlow] stage={} samples={} skippedTokens={} evaluationId={}",
                SERIES_PARSED, series.values().size(), series.skippedTokens(), evaluationId);
            if (series.truncated()) {
                log.warn("[EvaluationFlow] stage={} maxPoints={} evaluationId={}",
                    SERIES_TRUNCATED, maxPoints, evaluationId);
            }
        });
    }

    /**
     * Logs how many rows asserted an alert. Called once per request, after the engine run.
     */
    public void logRows(List<AlertRow> rows, String evaluationId) {
        long asserted = rows.stream().filter(row -> row.alert().asserted()).count();
        withMdc(evaluationId, () ->
            log.info("[EvaluationFlow] stage={} rows={} asserted={} evaluationId={}",
                ROWS_EMITTED, rows.size(), asserted, evaluationId)
        );
    }

    private static void withMdc(String evaluationId, Runnable logAction) {
        MDC.put(EVALUATION_ID_KEY, evaluationId);
        try {
            logAction.run();
        } finally {
            MDC.remove(EVALUATION_ID_KEY);
        }
    }
}
