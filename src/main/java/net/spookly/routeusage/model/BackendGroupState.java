package net.spookly.routeusage.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * NEG usage tally for one service, split by who created the endpoint groups.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class BackendGroupState {
    /**
     * Count of standalone NEGs.
     */
    private final int standaloneCount;
    /**
     * Count of NEGs created for routing objects.
     */
    private final int ingressCount;
    /**
     * Count of NEGs created for the service mesh.
     */
    private final int meshCount;

    public BackendGroupState(int standaloneCount, int ingressCount, int meshCount) {
        requireNonNegative(standaloneCount, "standaloneCount");
        requireNonNegative(ingressCount, "ingressCount");
        requireNonNegative(meshCount, "meshCount");
        this.standaloneCount = standaloneCount;
        this.ingressCount = ingressCount;
        this.meshCount = meshCount;
    }

    /**
     * Sum of all three counts, widened so it cannot overflow.
     */
    public long total() {
        return (long) standaloneCount + ingressCount + meshCount;
    }

    private static void requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
    }
}
