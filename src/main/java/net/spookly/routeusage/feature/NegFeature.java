package net.spookly.routeusage.feature;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Network endpoint group tallies by origin. {@link #NEG} is the combined total.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public enum NegFeature implements FeatureTag {
    STANDALONE_NEG("StandaloneNEG"),
    INGRESS_NEG("IngressNEG"),
    ASM_NEG("AsmNEG"),
    NEG("NEG");

    private final String label;
}
