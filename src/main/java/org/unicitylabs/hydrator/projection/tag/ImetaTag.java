package org.unicitylabs.hydrator.projection.tag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NIP-92 "imeta": ["imeta", "url https://...", "m image/jpeg", "dim 640x480", ...].
 */
public final class ImetaTag extends Tag {

    private final Map<String, String> entries = new LinkedHashMap<>();

    ImetaTag(List<String> raw) {
        super(raw);
        for (int i = 1; i < raw.size(); i++) {
            String entry = raw.get(i);
            int space = entry.indexOf(' ');
            if (space > 0) {
                entries.putIfAbsent(entry.substring(0, space), entry.substring(space + 1).trim());
            }
        }
    }

    public String get(String key) {
        return entries.get(key);
    }

    public String getUrl() {
        return entries.get("url");
    }

    public String getMimeType() {
        return entries.get("m");
    }
}
