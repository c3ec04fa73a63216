package com.acme.furfolio.eventlog.render;

import com.acme.furfolio.eventlog.audit.EventRecord;
import com.acme.furfolio.eventlog.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable and JSON renderings of recorded events.
 *
 * <p>Line format:
 * {@code <timestamp> <name> <metadata> | role:<role> staffID:<staffId> context:<context> escalate:<YES|NO>}.
 * Absent fields render as {@code -}; absent or empty metadata renders as {@code none}.
 * Metadata pairs keep the record's insertion order.</p>
 */
public final class DiagnosticsRenderer {
    static final String ABSENT = "-";
    static final String NO_METADATA = "none";

    private DiagnosticsRenderer() {
    }

    public static String render(List<EventRecord> records) {
        if (records == null || records.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(records.size() * 128);
        for (EventRecord record : records) {
            appendLine(sb, record).append('\n');
        }
        return sb.toString();
    }

    public static String renderLine(EventRecord record) {
        return appendLine(new StringBuilder(128), record).toString();
    }

    public static String renderMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return NO_METADATA;
        }
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.toString();
    }

    public static String renderJson(List<EventRecord> records) throws JsonProcessingException {
        List<Map<String, Object>> rows = new ArrayList<>(records == null ? 0 : records.size());
        if (records != null) {
            for (EventRecord record : records) {
                rows.add(toJsonMap(record));
            }
        }
        return JsonCodec.writeString(rows);
    }

    /**
     * Field map shared by the JSON export and the HTTP delivery payload.
     */
    public static Map<String, Object> toJsonMap(EventRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", record.id());
        row.put("sequence", record.sequence());
        row.put("timestamp", record.timestamp().toString());
        row.put("name", record.name() == null ? "" : record.name());
        row.put("metadata", record.metadata());
        row.put("role", record.role());
        row.put("staffID", record.staffId());
        row.put("context", record.context());
        row.put("escalate", record.escalate());
        return row;
    }

    private static StringBuilder appendLine(StringBuilder sb, EventRecord record) {
        sb.append(record.timestamp())
            .append(' ')
            .append(record.name() == null ? "" : record.name())
            .append(' ')
            .append(renderMetadata(record.metadata()))
            .append(" | role:").append(orAbsent(record.role()))
            .append(" staffID:").append(orAbsent(record.staffId()))
            .append(" context:").append(orAbsent(record.context()))
            .append(" escalate:").append(record.escalate() ? "YES" : "NO");
        return sb;
    }

    private static String orAbsent(String value) {
        return value == null ? ABSENT : value;
    }
}
