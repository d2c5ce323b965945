package tw.gc.paper.trader.exceptions;

/**
 * Thrown when a historical series is too short to replay a strategy over its lookback window.
 */
public class InsufficientHistoryException extends RuntimeException {

    private final int available;
    private final int required;

    public InsufficientHistoryException(String strategyId, int available, int required) {
        super("Strategy %s needs %d samples, history has %d".formatted(strategyId, required, available));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
