package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.constants.TripleConstants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node name -> "of interest" flag, loaded once per run and read-only afterwards
 *
 * Lookup is by exact name. The first row of a duplicated name wins.
 */
public class NodeReferenceTable {

    private final Map<String, String> flagsByName;

    public NodeReferenceTable(Map<String, String> flagsByName) {
        this.flagsByName = Collections.unmodifiableMap(new LinkedHashMap<>(flagsByName));
    }

    public static NodeReferenceTable empty() {
        return new NodeReferenceTable(Collections.emptyMap());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return name != null && flagsByName.containsKey(name);
    }

    /**
     * Raw flag cell, null when the name is unknown
     */
    public String getFlag(String name) {
        return name == null ? null : flagsByName.get(name);
    }

    /**
     * A set flag is any non-blank value other than false/no/0/n
     */
    public static boolean isFlagSet(String flag) {
        if (flag == null || flag.trim().isEmpty()) {
            return false;
        }
        return !TripleConstants.NodeReference.FALSE_FLAGS.contains(flag.trim().toLowerCase());
    }

    public int size() {
        return flagsByName.size();
    }

    public Map<String, String> asMap() {
        return flagsByName;
    }

    public static class Builder {
        private final Map<String, String> flagsByName = new LinkedHashMap<>();

        public Builder add(String name, String flag) {
            if (name != null) {
                flagsByName.putIfAbsent(name, flag);
            }
            return this;
        }

        public NodeReferenceTable build() {
            return new NodeReferenceTable(flagsByName);
        }
    }
}
