package com.williamcallahan.mathtext.service.formatting;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-call store of protected regions swapped out for opaque keys.
 *
 * <p>Keys are built from private-use code points that are stripped from every input before
 * processing starts, so a key can never collide with user text. Restoration runs in reverse
 * insertion order so a region that was masked while containing an earlier key comes back whole.</p>
 */
final class MaskArena {
    static final char KEY_OPEN = '\uE000';
    static final char KEY_CLOSE = '\uE001';
    private static final char MASK_TAG = 'M';

    private final List<String> protectedRegions = new ArrayList<>();

    /**
     * Stores a region and returns the key that stands in for it.
     */
    String mask(String region) {
        String key = keyFor(protectedRegions.size());
        protectedRegions.add(region);
        return key;
    }

    /**
     * Replaces every match of the pattern with a fresh key.
     */
    String maskAll(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder masked = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(masked, Matcher.quoteReplacement(mask(matcher.group())));
        }
        matcher.appendTail(masked);
        return masked.toString();
    }

    /**
     * Puts every stored region back in place of its key.
     */
    String restore(String text) {
        String restored = text;
        for (int index = protectedRegions.size() - 1; index >= 0; index--) {
            restored = restored.replace(keyFor(index), protectedRegions.get(index));
        }
        return restored;
    }

    int size() {
        return protectedRegions.size();
    }

    static String keyFor(int index) {
        return String.valueOf(KEY_OPEN) + MASK_TAG + index + KEY_CLOSE;
    }

    /**
     * Removes the key delimiters from raw input so user text can never forge a key.
     */
    static String stripKeyDelimiters(String raw) {
        if (raw.indexOf(KEY_OPEN) < 0 && raw.indexOf(KEY_CLOSE) < 0) {
            return raw;
        }
        StringBuilder stripped = new StringBuilder(raw.length());
        for (int index = 0; index < raw.length(); index++) {
            char current = raw.charAt(index);
            if (current != KEY_OPEN && current != KEY_CLOSE) {
                stripped.append(current);
            }
        }
        return stripped.toString();
    }
}
