package com.chicu.aiforecast.etl.features;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

/**
 * Упорядоченный список фич + SHA-256 от имён.
 * Пишется в манифест снапшота и в артефакт модели: при инференсе порядок обязан совпасть.
 */
public class FeatureSchema {

    private final String[] names;
    private final String schemaHash;

    public FeatureSchema(String[] names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("schema names пустые");
        }
        Set<String> unique = new HashSet<>();
        for (String n : names) {
            if (n == null || n.isBlank()) {
                throw new IllegalArgumentException("schema содержит пустое имя");
            }
            if (!unique.add(n)) {
                throw new IllegalArgumentException("schema: дубль фичи '" + n + "'");
            }
        }
        this.names = names.clone();
        this.schemaHash = sha256(String.join("|", this.names));
    }

    public FeatureSchema(List<String> names) {
        this(names != null ? names.toArray(new String[0]) : null);
    }

    public String[] featureNames() {
        return names.clone();
    }

    public List<String> names() {
        return List.of(names);
    }

    public int size() {
        return names.length;
    }

    public int indexOf(String name) {
        for (int i = 0; i < names.length; i++) {
            if (names[i].equals(name)) return i;
        }
        return -1;
    }

    public String schemaHash() {
        return schemaHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSchema other)) return false;
        return Arrays.equals(names, other.names);
    }

    @Override
    public int hashCode() {
        return schemaHash.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSchema" + Arrays.toString(names);
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
