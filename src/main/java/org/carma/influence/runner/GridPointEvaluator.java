package org.carma.influence.runner;

import org.carma.influence.model.Condition;
import org.carma.influence.model.Conversation;
import org.carma.influence.model.GridPoint;
import org.carma.influence.model.ResultRow;
import org.carma.influence.simulation.MetricsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates one grid point: a baseline and an influence conversation with the same
 * seed, reduced to one {@link ResultRow}.
 *
 * Never throws for a per-point problem. Protocol failures come back as FAILED rows
 * from the metrics, and unexpected runtime errors become all-sentinel FAILED rows.
 */
public class GridPointEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GridPointEvaluator.class);

    /**
     * @param repairedTurns turns across both conversations that needed a repair request
     */
    public record Evaluation(ResultRow row, int repairedTurns) {}

    private final ConversationRunner runner;
    private final MetricsEngine metrics;

    public GridPointEvaluator(ConversationRunner runner, MetricsEngine metrics) {
        this.runner = runner;
        this.metrics = metrics;
    }

    public Evaluation evaluate(GridPoint point) {
        try {
            Conversation baseline = runner.run(point, Condition.BASELINE);
            Conversation influence = runner.run(point, Condition.INFLUENCE);
            return new Evaluation(metrics.resultRow(point, baseline, influence),
                baseline.getRepairedTurnCount() + influence.getRepairedTurnCount());
        } catch (RuntimeException e) {
            log.error("Evaluation of {} failed unexpectedly", point, e);
            return new Evaluation(ResultRow.failed(point, e.getClass().getSimpleName() + ": " + e.getMessage()), 0);
        }
    }
}
