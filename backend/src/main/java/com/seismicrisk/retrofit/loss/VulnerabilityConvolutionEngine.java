package com.seismicrisk.retrofit.loss;

import com.seismicrisk.retrofit.aggregation.CurveResampler;
import com.seismicrisk.retrofit.domain.error.DegenerateCurveException;
import com.seismicrisk.retrofit.domain.error.IncompatibleIntensityMeasureException;
import com.seismicrisk.retrofit.domain.model.HazardCurve;
import com.seismicrisk.retrofit.domain.model.LossExceedanceCurve;
import com.seismicrisk.retrofit.domain.model.LossUnit;
import com.seismicrisk.retrofit.domain.model.VulnerabilityFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns a hazard curve and a vulnerability function into a loss-exceedance curve.
 *
 * ALGORITHM:
 * 1. Resample the hazard onto its own levels plus the vulnerability levels inside the
 *    hazard's range; vulnerability levels beyond the hazard's ends are dropped
 * 2. Split it into bins; bin mass = p_i - p_i+1 (negative mass counts as zero), plus a
 *    tail bin holding p_last at the hazard's top level
 * 3. Evaluate the loss-ratio distribution at each bin's representative intensity:
 *    a point mass when CoV or mean is zero, otherwise a lognormal cut into
 *    equal-probability strata
 * 4. Merge atoms closer than the loss resolution
 * 5. PoE at loss L = total mass of atoms with loss strictly greater than L, on the
 *    support {0} + atom losses + {1}
 *
 * Stateless; one instance serves all assets and both vulnerability variants concurrently.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VulnerabilityConvolutionEngine {

    private final CurveValidator curveValidator;

    public LossExceedanceCurve convolve(String assetId,
                                        HazardCurve hazard,
                                        VulnerabilityFunction function,
                                        ConvolutionSettings settings) {
        if (!hazard.intensityMeasureType().equals(function.intensityMeasureType())) {
            throw new IncompatibleIntensityMeasureException(hazard.intensityMeasureType(),
                    function.intensityMeasureType());
        }
        if (hazard.size() == 0) {
            throw new DegenerateCurveException("Hazard curve for site " + hazard.siteId() + " has no levels");
        }
        curveValidator.validate(hazard);
        curveValidator.validate(function);

        double[] support = CurveResampler.commonSupport(hazard.levels(), function.levels());
        double[] poes = CurveResampler.resample(hazard.levels(), hazard.poes(), support);

        List<Atom> atoms = new ArrayList<>();
        int last = support.length - 1;
        for (int i = 0; i < last; i++) {
            double mass = Math.max(0.0, poes[i] - poes[i + 1]);
            double intensity = settings.binRepresentative().pick(support[i], support[i + 1]);
            addLossDistribution(atoms, function, intensity, mass, settings.lossRatioSamples());
        }
        addLossDistribution(atoms, function, support[last], Math.max(0.0, poes[last]), settings.lossRatioSamples());

        List<Atom> merged = merge(atoms, settings.lossCurveResolution());
        log.debug("Asset {}: {} bins gave {} loss atoms ({} after merging)",
                assetId, support.length, atoms.size(), merged.size());
        return exceedanceCurve(assetId, merged);
    }

    private void addLossDistribution(List<Atom> atoms, VulnerabilityFunction function,
                                     double intensity, double mass, int samples) {
        if (mass <= 0.0) {
            return;
        }
        double mean = function.meanLossRatioAt(intensity);
        double cov = function.coefficientOfVariationAt(intensity);
        if (cov <= 0.0 || mean <= 0.0) {
            atoms.add(new Atom(clamp(mean), mass));
            return;
        }
        double shape = Math.sqrt(Math.log1p(cov * cov));
        double scale = Math.log(mean) - shape * shape / 2.0;
        LogNormalDistribution distribution = new LogNormalDistribution(scale, shape);
        double stratumMass = mass / samples;
        for (int k = 0; k < samples; k++) {
            double lossRatio = distribution.inverseCumulativeProbability((k + 0.5) / samples);
            atoms.add(new Atom(clamp(lossRatio), stratumMass));
        }
    }

    private static List<Atom> merge(List<Atom> atoms, double resolution) {
        List<Atom> sorted = new ArrayList<>(atoms);
        sorted.sort(Comparator.comparingDouble(Atom::loss));
        List<Atom> merged = new ArrayList<>();
        for (Atom atom : sorted) {
            if (!merged.isEmpty()) {
                Atom previous = merged.get(merged.size() - 1);
                if (atom.loss() - previous.loss() < resolution) {
                    double probability = previous.probability() + atom.probability();
                    double loss = (previous.loss() * previous.probability() + atom.loss() * atom.probability())
                            / probability;
                    merged.set(merged.size() - 1, new Atom(loss, probability));
                    continue;
                }
            }
            merged.add(atom);
        }
        return merged;
    }

    private static LossExceedanceCurve exceedanceCurve(String assetId, List<Atom> atoms) {
        TreeSet<Double> support = new TreeSet<>();
        support.add(0.0);
        support.add(1.0);
        atoms.forEach(atom -> support.add(atom.loss()));

        double[] losses = new double[support.size()];
        double[] poes = new double[support.size()];
        int i = 0;
        for (double loss : support) {
            double exceedance = 0.0;
            for (Atom atom : atoms) {
                if (atom.loss() > loss) {
                    exceedance += atom.probability();
                }
            }
            losses[i] = loss;
            poes[i] = exceedance;
            i++;
        }
        return new LossExceedanceCurve(assetId, LossUnit.LOSS_RATIO, losses, poes);
    }

    private static double clamp(double lossRatio) {
        return Math.min(1.0, Math.max(0.0, lossRatio));
    }

    private record Atom(double loss, double probability) {
    }
}
