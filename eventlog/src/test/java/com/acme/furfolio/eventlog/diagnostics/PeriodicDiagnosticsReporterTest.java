package com.acme.furfolio.eventlog.diagnostics;

import com.acme.furfolio.eventlog.context.AuditContext;
import com.acme.furfolio.eventlog.recorder.EventRecorder;
import com.acme.furfolio.eventlog.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodicDiagnosticsReporterTest {

    @Test
    void shouldRenderDiagnosticsAsJsonLine() throws Exception {
        try (EventRecorder recorder = EventRecorder.builder(AuditContext.create("RetentionAlertEngine")).capacity(3).build()) {
            recorder.record("alert_critical_customer");
            recorder.record("alert_sent");

            JsonNode line = JsonCodec.readTree(PeriodicDiagnosticsReporter.renderLine(recorder));

            assertEquals("eventlog_diagnostics", line.get("type").asText());
            assertEquals("RetentionAlertEngine", line.get("component").asText());
            assertEquals("2", line.get("bufferedEvents").asText());
            assertEquals("1", line.get("escalatedInBuffer").asText());
            assertEquals("3", line.get("capacity").asText());
        }
    }

    @Test
    void emitShouldLogOneLinePerRecorder() {
        Logger logger = Logger.getLogger(PeriodicDiagnosticsReporter.class.getName());
        List<String> lines = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                lines.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Level previous = logger.getLevel();
        logger.setLevel(Level.INFO);
        logger.addHandler(capture);
        try (EventRecorder a = EventRecorder.builder(AuditContext.create("A")).build();
             EventRecorder b = EventRecorder.builder(AuditContext.create("B")).build();
             PeriodicDiagnosticsReporter reporter = new PeriodicDiagnosticsReporter(List.of(a, b), 60)) {
            reporter.emit();

            assertEquals(2, lines.size());
            assertTrue(lines.get(0).contains("\"component\":\"A\""));
            assertTrue(lines.get(1).contains("\"component\":\"B\""));
        } finally {
            logger.removeHandler(capture);
            logger.setLevel(previous);
        }
    }
}
