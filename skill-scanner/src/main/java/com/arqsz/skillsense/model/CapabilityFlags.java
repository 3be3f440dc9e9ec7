package com.arqsz.skillsense.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of detected capabilities. Flags can only be added, never cleared.
 */
public final class CapabilityFlags {

    private static final CapabilityFlags NONE = new CapabilityFlags(EnumSet.noneOf(Capability.class));

    private final Set<Capability> detected;

    private CapabilityFlags(EnumSet<Capability> detected) {
        this.detected = Collections.unmodifiableSet(detected);
    }

    public static CapabilityFlags none() {
        return NONE;
    }

    public static CapabilityFlags of(Capability... capabilities) {
        EnumSet<Capability> set = EnumSet.noneOf(Capability.class);
        Collections.addAll(set, capabilities);
        return new CapabilityFlags(set);
    }

    public boolean has(Capability capability) {
        return detected.contains(capability);
    }

    /**
     * Bitwise OR of two flag sets
     * 
     * @param other The flags to merge
     * @return A new instance holding every capability of either side
     */
    public CapabilityFlags union(CapabilityFlags other) {
        EnumSet<Capability> merged = EnumSet.noneOf(Capability.class);
        merged.addAll(detected);
        merged.addAll(other.detected);
        return new CapabilityFlags(merged);
    }

    public boolean containsAll(CapabilityFlags other) {
        return detected.containsAll(other.detected);
    }

    /**
     * Returns every capability key with its flag, in declaration order
     * 
     * @return Ordered key to boolean map
     */
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (Capability capability : Capability.values()) {
            map.put(capability.key(), detected.contains(capability));
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CapabilityFlags other && detected.equals(other.detected);
    }

    @Override
    public int hashCode() {
        return detected.hashCode();
    }

    @Override
    public String toString() {
        return "CapabilityFlags" + asMap();
    }

    /**
     * Accumulates flags across files; {@link #set} is idempotent and there is no unset
     */
    public static final class Builder {
        private final EnumSet<Capability> detected = EnumSet.noneOf(Capability.class);

        public Builder set(Capability capability) {
            detected.add(capability);
            return this;
        }

        public CapabilityFlags build() {
            return new CapabilityFlags(EnumSet.copyOf(detected));
        }
    }
}
