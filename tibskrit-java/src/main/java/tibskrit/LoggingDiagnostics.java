package tibskrit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default diagnostics: dropped characters at error level, anomalies at warn level.
 */
public final class LoggingDiagnostics implements Diagnostics {

    public static final LoggingDiagnostics INSTANCE = new LoggingDiagnostics();

    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnostics.class);

    private LoggingDiagnostics() {}

    @Override
    public void unsupportedCharacter(int codePoint, int offset) {
        log.error("{} (U+{}) at {} cannot be converted to IAST",
            new String(Character.toChars(codePoint)), String.format("%04X", codePoint), offset);
    }

    @Override
    public void anomaly(Anomaly anomaly, Token token) {
        log.warn("{}: {}", anomaly.getMessage(), token);
    }
}
