package com.keystone.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * Code bundle produced by an agent: relative path to file content.
 */
public record Artifact(Map<String, String> files) implements Serializable {

    public Artifact {
        files = files == null ? Map.of() : java.util.Collections.unmodifiableMap(new TreeMap<>(files));
    }

    @JsonIgnore
    public int fileCount() {
        return files.size();
    }
}
