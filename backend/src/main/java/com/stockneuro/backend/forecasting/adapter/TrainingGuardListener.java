package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.exception.TrainingDivergedException;
import org.deeplearning4j.nn.api.Model;
import org.deeplearning4j.optimize.api.BaseTrainingListener;

/**
 * Aborts a fit as soon as the loss turns non-finite or the run is cancelled.
 */
class TrainingGuardListener extends BaseTrainingListener {

    private final CancellationToken cancellationToken;

    TrainingGuardListener(CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken;
    }

    @Override
    public void iterationDone(Model model, int iteration, int epoch) {
        double score = model.score();
        if (!Double.isFinite(score)) {
            throw new TrainingDivergedException("Loss became non-finite (" + score + ") at iteration "
                    + iteration + ", epoch " + epoch);
        }
        cancellationToken.throwIfCancelled();
    }
}
