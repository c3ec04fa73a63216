package com.acme.furfolio.eventlog.audit;

import com.acme.furfolio.eventlog.render.DiagnosticsRenderer;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Reference sink: prints one diagnostics line per record when verbose, otherwise does nothing.
 */
public final class ConsoleAnalyticsDelivery implements AnalyticsDelivery {
    private final PrintStream out;
    private final boolean verbose;

    public ConsoleAnalyticsDelivery(boolean verbose) {
        this(System.out, verbose);
    }

    public ConsoleAnalyticsDelivery(PrintStream out, boolean verbose) {
        this.out = Objects.requireNonNull(out, "out");
        this.verbose = verbose;
    }

    public boolean verbose() {
        return verbose;
    }

    @Override
    public void deliver(EventRecord record) {
        if (!verbose || record == null) {
            return;
        }
        out.println(DiagnosticsRenderer.renderLine(record));
    }
}
