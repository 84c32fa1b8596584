package com.seismicrisk.retrofit.domain.model;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Named set of vulnerability functions, one per taxonomy.
 */
public record VulnerabilityModel(
        String reference,
        VulnerabilityVariant variant,
        Map<String, VulnerabilityFunction> functions
) {

    public VulnerabilityModel {
        functions = Map.copyOf(functions);
    }

    public static VulnerabilityModel of(String reference, VulnerabilityVariant variant,
                                        VulnerabilityFunction... functions) {
        Map<String, VulnerabilityFunction> byTaxonomy = new TreeMap<>();
        for (VulnerabilityFunction fn : functions) {
            byTaxonomy.put(fn.taxonomy(), fn);
        }
        return new VulnerabilityModel(reference, variant, byTaxonomy);
    }

    public Optional<VulnerabilityFunction> functionFor(String taxonomy) {
        return Optional.ofNullable(functions.get(taxonomy));
    }
}
