package com.javis.intent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public class IntentCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(IntentCatalogLoader.class);
    private static final String DEFAULT_RESOURCE = "intents.yaml";

    public static IntentCatalog loadDefault() {
        try (var in = IntentCatalogLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Bundled " + DEFAULT_RESOURCE + " not found");
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled intent catalog", e);
        }
    }

    public static IntentCatalog load(Path path) {
        try (var in = Files.newInputStream(path)) {
            var catalog = parse(in);
            log.info("Loaded {} intents from {}", catalog.size(), path);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read intent catalog " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static IntentCatalog parse(InputStream in) {
        Map<String, Object> raw = new Yaml().load(in);
        if (raw == null) return new IntentCatalog(List.of());
        var entries = (List<Map<String, Object>>) raw.getOrDefault("intents", List.of());
        var definitions = new ArrayList<IntentDefinition>();
        for (var entry : entries) {
            var label = (String) entry.get("label");
            var examples = ((List<Object>) entry.getOrDefault("examples", List.of())).stream()
                    .map(String::valueOf).toList();
            var patterns = ((List<Object>) entry.getOrDefault("patterns", List.of())).stream()
                    .map(p -> compile(label, String.valueOf(p))).toList();
            var slots = new LinkedHashMap<String, Pattern>();
            ((Map<String, Object>) entry.getOrDefault("slots", Map.of()))
                    .forEach((name, p) -> slots.put(name, compile(label, String.valueOf(p))));
            definitions.add(new IntentDefinition(label, examples, patterns, slots));
        }
        return new IntentCatalog(definitions);
    }

    private static Pattern compile(String label, String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid pattern for intent '" + label + "': " + regex, e);
        }
    }
}
