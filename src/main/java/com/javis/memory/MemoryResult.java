package com.javis.memory;

import java.util.Map;

public record MemoryResult(MemoryRecord record, double score) {

    public String id() { return record.id(); }

    public String text() { return record.text(); }

    public Map<String, Object> metadata() { return record.metadata(); }
}
