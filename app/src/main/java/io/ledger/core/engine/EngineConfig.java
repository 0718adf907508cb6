package io.ledger.core.engine;

import java.nio.file.Path;
import java.util.logging.Level;

/** Simple config holder for one ledger run. */
public final class EngineConfig {
    public static final int MAX_SCALE = 18;

    /** Decimal places accepted on input and rendered on output. */
    public final int scale;
    public final Level logLevel;
    /** Null means stdout. */
    public final Path output;
    public final boolean printMetrics;

    public EngineConfig(int scale, Level logLevel, Path output, boolean printMetrics) {
        if (scale < 0 || scale > MAX_SCALE) {
            throw new IllegalArgumentException("scale must be within 0.." + MAX_SCALE + ": " + scale);
        }
        this.scale = scale;
        this.logLevel = logLevel == null ? Level.WARNING : logLevel;
        this.output = output;
        this.printMetrics = printMetrics;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
                4,              // four decimal places
                Level.WARNING,
                null,
                false
        );
    }

    public EngineConfig withScale(int scale) {
        return new EngineConfig(scale, this.logLevel, this.output, this.printMetrics);
    }

    public EngineConfig withOutput(Path output) {
        return new EngineConfig(this.scale, this.logLevel, output, this.printMetrics);
    }
}
