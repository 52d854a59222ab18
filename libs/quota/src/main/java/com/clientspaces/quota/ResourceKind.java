package com.clientspaces.quota;

import java.util.Locale;

/**
 * Kind of tenant-owned resource whose total count is capped by the plan (e.g. {@code client-space}).
 *
 * @param name lower-case kebab name, as used in configuration
 */
public record ResourceKind(String name) {

    public static final ResourceKind CLIENT_SPACE = new ResourceKind("client-space");
    public static final ResourceKind EXTERNAL_USER = new ResourceKind("external-user");
    public static final ResourceKind LIBRARY = new ResourceKind("library");
    public static final ResourceKind ADMIN = new ResourceKind("admin");

    public ResourceKind {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("resource kind name must not be null or blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
    }

    public static ResourceKind of(String name) {
        return new ResourceKind(name);
    }

    /** "client-space" → "Client space". */
    public String displayName() {
        String words = name.replace('-', ' ');
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    @Override
    public String toString() {
        return name;
    }
}
