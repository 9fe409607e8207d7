package com.zzf.clawcontrol.sync;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides which paths take part in sync: documents with a recognized extension, none
 * of whose path segments starts with a dot. Extensions match case-sensitively, so
 * {@code B.MD} is not a {@code .md} document.
 */
public class DocumentFilter {
    private final Set<String> extensions;

    public DocumentFilter(Set<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        if (extensions != null) {
            for (String ext : extensions) {
                if (ext == null || ext.isBlank()) {
                    continue;
                }
                String e = ext.trim();
                normalized.add(e.startsWith(".") ? e : "." + e);
            }
        }
        if (normalized.isEmpty()) {
            normalized.add(".md");
        }
        this.extensions = Set.copyOf(normalized);
    }

    public static DocumentFilter markdown() {
        return new DocumentFilter(Set.of(".md"));
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    public boolean isHidden(String name) {
        return name == null || name.isEmpty() || name.startsWith(".");
    }

    public boolean isDocumentName(String name) {
        if (isHidden(name)) {
            return false;
        }
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param relativePath forward-slash path relative to the notes root
     */
    public boolean accepts(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return false;
        }
        String[] segments = relativePath.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (isHidden(segments[i])) {
                return false;
            }
        }
        return isDocumentName(segments[segments.length - 1]);
    }

    public static String normalize(String path) {
        if (path == null) {
            return null;
        }
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }
}
