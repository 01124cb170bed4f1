package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.models.params.ReconstructionParameters;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Reconstruction-error detector over a linear principal subspace.
 *
 * Genuine vectors are compressed onto their leading principal components, the
 * eigenvectors of the training covariance with the largest eigenvalues. The score
 * is 1 / (1 + e / p95), where e is the window's mean squared reconstruction error and p95 the 95th percentile of the
 * training errors.
 */
public class ReconstructionModel implements ScoringModel {

    private static final double MIN_EIGENVALUE = 1e-10;
    private static final double MIN_ERROR = 1e-6;

    private final int configuredComponents;

    public ReconstructionModel(EngineConfig config) {
        this.configuredComponents = config.getReconstructionComponents();
    }

    @Override
    public ModelKind kind() {
        return ModelKind.RECONSTRUCTION;
    }

    @Override
    public ModelProfile train(TrainingSet trainingSet) {
        int n = trainingSet.size();
        double[][] rows = new double[n][];
        for (int t = 0; t < n; t++) {
            rows[t] = trainingSet.row(t);
        }
        double[][] components = principalComponents(rows, componentCount(trainingSet.featureCount()));

        ReconstructionParameters parameters = new ReconstructionParameters();
        parameters.setComponents(components);
        double[] errors = new double[n];
        for (int t = 0; t < n; t++) {
            errors[t] = reconstructionError(parameters.getComponents(), trainingSet.row(t));
        }
        parameters.setErrorMedian(ModelSupport.percentile(errors, 0.5));
        parameters.setErrorP95(Math.max(MIN_ERROR, ModelSupport.percentile(errors, 0.95)));
        return ModelSupport.newProfile(kind(), trainingSet, parameters);
    }

    @Override
    public double score(ModelProfile profile, List<FeatureWindow> recent) {
        ReconstructionParameters parameters =
            ModelSupport.requireParameters(profile, kind(), ReconstructionParameters.class);
        double[] z = ModelSupport.standardize(profile, recent.get(recent.size() - 1));
        double error = reconstructionError(parameters.getComponents(), z);
        return 1.0 / (1.0 + error / parameters.getErrorP95());
    }

    /**
     * Uses about a third of the features unless configured, always leaving a residual space
     */
    private int componentCount(int d) {
        if (d <= 1) {
            return 0;
        }
        int wanted = configuredComponents > 0 ? configuredComponents : Math.max(1, Math.round(d / 3.0f));
        return Math.min(wanted, d - 1);
    }

    /**
     * Mean squared residual over the features present in {@code z}; missing
     * features take no part in the projection.
     */
    static double reconstructionError(double[][] components, double[] z) {
        double[] filled = ModelSupport.imputed(z);
        double[] residual = filled.clone();
        for (double[] component : components) {
            double projection = 0.0;
            for (int i = 0; i < filled.length; i++) {
                projection += component[i] * filled[i];
            }
            for (int i = 0; i < filled.length; i++) {
                residual[i] -= projection * component[i];
            }
        }
        double sum = 0.0;
        int present = 0;
        for (int i = 0; i < z.length; i++) {
            if (!Double.isNaN(z[i])) {
                sum += residual[i] * residual[i];
                present++;
            }
        }
        return present == 0 ? 0.0 : sum / present;
    }

    /**
     * Eigenvectors of the biased sample covariance, largest eigenvalue first.
     * Directions without variance are left out.
     */
    static double[][] principalComponents(double[][] rows, int wanted) {
        if (wanted <= 0 || rows.length < 2) {
            return new double[0][];
        }
        RealMatrix covariance = new Covariance(new Array2DRowRealMatrix(rows, false), false).getCovarianceMatrix();
        EigenDecomposition decomposition = new EigenDecomposition(covariance);
        double[] eigenvalues = decomposition.getRealEigenvalues();
        Integer[] order = new Integer[eigenvalues.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());

        List<double[]> components = new ArrayList<>(wanted);
        for (Integer index : order) {
            if (components.size() == wanted || eigenvalues[index] <= MIN_EIGENVALUE) {
                break;
            }
            components.add(decomposition.getEigenvector(index).unitVector().toArray());
        }
        return components.toArray(new double[0][]);
    }
}
