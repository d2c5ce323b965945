package tw.gc.paper.trader.exceptions;

/**
 * Malformed risk policy. Raised during startup validation and treated as fatal.
 */
public class InvalidRiskPolicyException extends RuntimeException {

    public InvalidRiskPolicyException(String message) {
        super(message);
    }
}
