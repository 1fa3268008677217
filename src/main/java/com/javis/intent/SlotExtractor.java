package com.javis.intent;

import com.javis.memory.MemoryResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based slot filling. Recent memory hits can fill a declared slot that
 * the text only refers to ("scan it again"); they never add undeclared slots.
 */
public class SlotExtractor {

    private static final Pattern ANAPHORA = Pattern.compile("\\b(it|that|this|there|them)\\b",
            Pattern.CASE_INSENSITIVE);

    private final IntentCatalog catalog;

    public SlotExtractor(IntentCatalog catalog) {
        this.catalog = catalog;
    }

    public Map<String, String> extract(String label, String text, List<MemoryResult> context) {
        var slots = new LinkedHashMap<String, String>();
        var def = catalog.get(label).orElse(null);
        if (def == null) return slots;

        for (var entry : def.slots().entrySet()) {
            var m = entry.getValue().matcher(text);
            if (!m.find()) continue;
            var value = valueOf(m, entry.getValue());
            if (value != null && !value.isBlank()) {
                slots.put(entry.getKey(), value.trim());
            }
        }

        if (context == null || context.isEmpty() || !ANAPHORA.matcher(text).find()) {
            return slots;
        }
        for (var name : def.slots().keySet()) {
            if (slots.containsKey(name)) continue;
            for (var hit : context) {
                var value = hit.metadata().get(name);
                if (value != null && !String.valueOf(value).isBlank()) {
                    slots.put(name, String.valueOf(value));
                    break;
                }
            }
        }
        return slots;
    }

    private static String valueOf(Matcher m, Pattern pattern) {
        if (pattern.pattern().contains("(?<value>")) return m.group("value");
        return m.groupCount() >= 1 ? m.group(1) : m.group();
    }
}
