package com.github.trinity.sourcefit;

import java.util.List;

/**
 * A differentiable scalar of the model parameters that the maximizer climbs.
 *
 * @author Sean Phillips
 */
@FunctionalInterface
public interface SourceObjective {

    SensitiveFloat evaluate(ModelParams mp);

    /**
     * Full ELBO over {@code stamps}, with pixel patches fixed from {@code start}.
     */
    static SourceObjective elbo(List<ImageStamp> stamps, ModelParams start) {
        List<SourcePatch> patches = SourcePatch.forModel(start, stamps);
        return mp -> ElboCalculator.elbo(stamps, mp, patches);
    }

    /**
     * Expected log-likelihood over {@code stamps}, with pixel patches fixed from {@code start}.
     */
    static SourceObjective likelihood(List<ImageStamp> stamps, ModelParams start) {
        List<SourcePatch> patches = SourcePatch.forModel(start, stamps);
        return mp -> ElboCalculator.elboLikelihood(stamps, mp, patches);
    }

    /**
     * Negative KL divergence from the priors alone.
     */
    static SourceObjective klOnly() {
        return mp -> {
            SensitiveFloat accum = SensitiveFloat.zero(mp.numSources());
            KlDivergence.subtractKl(mp, accum);
            return accum;
        };
    }
}
