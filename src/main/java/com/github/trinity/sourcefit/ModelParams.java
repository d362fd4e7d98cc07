package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * The variational parameters of every source in a field plus the shared priors.
 * <p>
 * Vectors are in constrained space and laid out by {@link ParamLayout}. They are
 * mutated in place by {@link ElboMaximizer}; the number of sources never changes.
 * </p>
 *
 * @author Sean Phillips
 */
public class ModelParams {

    private final List<double[]> vp;
    private PriorParams priors;

    public ModelParams(List<double[]> vp, PriorParams priors) {
        this.vp = new ArrayList<>(vp.size());
        for (double[] source : vp) {
            checkLength(source);
            this.vp.add(source);
        }
        this.priors = priors;
    }

    public int numSources() {
        return vp.size();
    }

    /**
     * Live parameter vector of source {@code s}.
     */
    public double[] source(int s) {
        return vp.get(s);
    }

    /**
     * Live list of parameter vectors.
     */
    public List<double[]> vp() {
        return vp;
    }

    public void setSource(int s, double[] values) {
        checkLength(values);
        System.arraycopy(values, 0, vp.get(s), 0, values.length);
    }

    public PriorParams priors() {
        return priors;
    }

    public void setPriors(PriorParams priors) {
        this.priors = priors;
    }

    public ModelParams copy() {
        return new ModelParams(SourceFitHelper.deepCopy(vp), priors);
    }

    /**
     * Re-checks every vector against the layout.
     *
     * @throws DimensionMismatchException if a vector has the wrong length
     */
    public void validate() {
        for (double[] source : vp) {
            checkLength(source);
        }
    }

    private static void checkLength(double[] source) {
        if (source.length != ParamLayout.SIZE) {
            throw new DimensionMismatchException(source.length, ParamLayout.SIZE);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ModelParams{");
        for (int s = 0; s < vp.size(); s++) {
            sb.append("\n  ").append(s).append(": ").append(Arrays.toString(vp.get(s)));
        }
        return sb.append("\n}").toString();
    }
}
