package tw.gc.paper.trader.exceptions;

/**
 * The market data feed cannot answer right now. Distinct from "no new sample".
 */
public class FeedUnavailableException extends RuntimeException {

    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
