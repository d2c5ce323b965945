package tw.gc.paper.trader.exceptions;

public class StatePersistenceException extends RuntimeException {

    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
