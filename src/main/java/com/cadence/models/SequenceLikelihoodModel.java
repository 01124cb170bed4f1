package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.models.params.SequenceParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Likelihood of the recent window sequence under a per-feature AR(1) Gaussian
 * transition model.
 *
 * The first step of a sequence is scored against the marginal distribution, each
 * following step against the transition from its predecessor. The mean negative
 * log-likelihood per feature and step is compared with its training distribution:
 * the training median scores 1 and the 95th percentile scores 0.5.
 */
public class SequenceLikelihoodModel implements ScoringModel {

    private static final double MIN_SIGMA = 0.1;
    private static final double MAX_AR = 0.99;

    private final int sequenceLength;

    public SequenceLikelihoodModel(EngineConfig config) {
        this.sequenceLength = config.getSequenceLength();
    }

    @Override
    public ModelKind kind() {
        return ModelKind.SEQUENCE;
    }

    @Override
    public ModelProfile train(TrainingSet trainingSet) {
        int n = trainingSet.size();
        int d = trainingSet.featureCount();
        double[] ar = new double[d];
        double[] residual = new double[d];
        double[] marginal = new double[d];

        for (int j = 0; j < d; j++) {
            double[] column = new double[n];
            double lagged = 0.0;
            double laggedSquares = 0.0;
            for (int t = 0; t < n; t++) {
                column[t] = trainingSet.row(t)[j];
                if (t > 0) {
                    lagged += column[t] * column[t - 1];
                    laggedSquares += column[t - 1] * column[t - 1];
                }
            }
            ar[j] = laggedSquares > 0 ? Math.max(-MAX_AR, Math.min(MAX_AR, lagged / laggedSquares)) : 0.0;

            double[] residuals = new double[n - 1];
            for (int t = 1; t < n; t++) {
                residuals[t - 1] = column[t] - ar[j] * column[t - 1];
            }
            residual[j] = Math.max(MIN_SIGMA, rootMeanSquare(residuals));
            marginal[j] = Math.max(MIN_SIGMA, rootMeanSquare(column));
        }

        SequenceParameters parameters = new SequenceParameters();
        parameters.setSequenceLength(sequenceLength);
        parameters.setArCoefficients(ar);
        parameters.setResidualStdDevs(residual);
        parameters.setMarginalStdDevs(marginal);

        double[] nll = new double[n];
        for (int t = 0; t < n; t++) {
            nll[t] = negativeLogLikelihood(parameters, paddedRows(trainingSet, t));
        }
        parameters.setNllMedian(ModelSupport.percentile(nll, 0.5));
        parameters.setNllP95(ModelSupport.percentile(nll, 0.95));

        return ModelSupport.newProfile(kind(), trainingSet, parameters);
    }

    @Override
    public double score(ModelProfile profile, List<FeatureWindow> recent) {
        SequenceParameters parameters = ModelSupport.requireParameters(profile, kind(), SequenceParameters.class);
        if (recent.isEmpty()) {
            throw new ModelScoreException(kind(), "No window to score");
        }
        int length = parameters.getSequenceLength();
        int from = Math.max(0, recent.size() - length);
        List<double[]> rows = new ArrayList<>(length);
        // Only the scored window must fit the profile; history that does not is left out.
        double[] current = ModelSupport.standardize(profile, recent.get(recent.size() - 1));
        for (int i = from; i < recent.size() - 1; i++) {
            try {
                rows.add(ModelSupport.standardize(profile, recent.get(i)));
            } catch (ModelScoreException e) {
                rows.clear();
            }
        }
        rows.add(current);
        double nll = negativeLogLikelihood(parameters, pad(rows, length));
        return score(parameters, nll);
    }

    @Override
    public double[] trainingScores(ModelProfile profile, TrainingSet trainingSet) {
        SequenceParameters parameters = ModelSupport.requireParameters(profile, kind(), SequenceParameters.class);
        double[] scores = new double[trainingSet.size()];
        for (int t = 0; t < trainingSet.size(); t++) {
            scores[t] = score(parameters, negativeLogLikelihood(parameters, paddedRows(trainingSet, t)));
        }
        return scores;
    }

    private static double score(SequenceParameters parameters, double nll) {
        double spread = parameters.getNllP95() - parameters.getNllMedian();
        return ModelSupport.halfLifeScore(nll, parameters.getNllMedian(), Math.max(spread, 1e-3));
    }

    private List<double[]> paddedRows(TrainingSet trainingSet, int end) {
        int from = Math.max(0, end - sequenceLength + 1);
        List<double[]> rows = new ArrayList<>(sequenceLength);
        for (int t = from; t <= end; t++) {
            rows.add(trainingSet.row(t));
        }
        return pad(rows, sequenceLength);
    }

    /**
     * Left-pads by repeating the earliest row up to the fixed length
     */
    static List<double[]> pad(List<double[]> rows, int length) {
        if (rows.size() >= length) {
            return rows;
        }
        List<double[]> padded = new ArrayList<>(length);
        double[] earliest = rows.get(0);
        for (int i = rows.size(); i < length; i++) {
            padded.add(earliest);
        }
        padded.addAll(rows);
        return padded;
    }

    static double negativeLogLikelihood(SequenceParameters parameters, List<double[]> rows) {
        double[] ar = parameters.getArCoefficients();
        double[] residual = parameters.getResidualStdDevs();
        double[] marginal = parameters.getMarginalStdDevs();
        int d = ar.length;
        double total = 0.0;
        int terms = 0;
        for (int step = 0; step < rows.size(); step++) {
            double[] z = rows.get(step);
            for (int j = 0; j < d; j++) {
                if (Double.isNaN(z[j])) {
                    continue;
                }
                double error;
                double sigma;
                if (step == 0 || Double.isNaN(rows.get(step - 1)[j])) {
                    error = z[j];
                    sigma = marginal[j];
                } else {
                    error = z[j] - ar[j] * rows.get(step - 1)[j];
                    sigma = residual[j];
                }
                double standardized = error / sigma;
                total += 0.5 * standardized * standardized + Math.log(sigma);
                terms++;
            }
        }
        return terms == 0 ? 0.0 : total / terms;
    }

    private static double rootMeanSquare(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v * v;
        }
        return Math.sqrt(sum / values.length);
    }
}
