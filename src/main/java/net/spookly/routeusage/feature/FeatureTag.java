package net.spookly.routeusage.feature;

/**
 * Feature vocabulary entry with the label used when counts are exported.
 */
public interface FeatureTag {
    String label();
}
