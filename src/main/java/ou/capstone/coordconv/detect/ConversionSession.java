package ou.capstone.coordconv.detect;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.coordconv.exceptions.UnrecognizedFormatException;

/**
 * Holds the "current coordinate" for an interactive front end.
 *
 * Two states: IDLE (nothing resolved) and RESOLVED (a coordinate and the
 * name of the format that produced it). A successful detection moves to
 * RESOLVED, a failed one back to IDLE. All methods synchronize on the
 * session so a parse and the following format pass see the same value.
 */
public final class ConversionSession {
    private static final Logger logger = LoggerFactory.getLogger(ConversionSession.class);

    public enum State { IDLE, RESOLVED }

    private final FormatDispatcher dispatcher;
    private Detection current;

    public ConversionSession() {
        this(new FormatDispatcher());
    }

    public ConversionSession(final FormatDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public synchronized State state() {
        return current == null ? State.IDLE : State.RESOLVED;
    }

    /** @return the last successful detection, empty when idle */
    public synchronized Optional<Detection> current() {
        return Optional.ofNullable(current);
    }

    /**
     * Detects the input's format and stores the parsed coordinate.
     *
     * @return name of the matching format
     * @throws UnrecognizedFormatException if nothing matched; the session is then idle
     */
    public synchronized String detect(final String text) throws UnrecognizedFormatException {
        try {
            current = dispatcher.detectAndParse(text);
            return current.name();
        } catch (final UnrecognizedFormatException e) {
            if (current != null) {
                logger.debug("Clearing resolved coordinate {}", current.coordinate());
            }
            current = null;
            throw e;
        }
    }

    /**
     * Renders the current coordinate in every format.
     *
     * @throws IllegalStateException if the session is idle
     */
    public synchronized List<String> formatAll() {
        if (current == null) {
            throw new IllegalStateException("No coordinate resolved");
        }
        return dispatcher.formatAll(current.coordinate());
    }

    /** Detection and rendering as one step. */
    public synchronized List<String> detectAndFormatAll(final String text) throws UnrecognizedFormatException {
        detect(text);
        return formatAll();
    }

    public synchronized void clear() {
        current = null;
    }
}
