package tw.gc.paper.trader.enums;

/**
 * Typed reasons an order or signal was not turned into a ledger mutation.
 */
public enum RejectionReason {
    FLAT_SIGNAL("Signal carries no direction"),
    LOW_CONFIDENCE("Signal confidence below configured minimum"),
    POSITION_ALREADY_OPEN("A position is already open"),
    SIZE_EXCEEDS_LIMIT("Requested size exceeds max position fraction of equity"),
    INVALID_STOP_PLACEMENT("Stop-loss or take-profit on the wrong side of entry"),
    BELOW_MINIMUM_SIZE("Order notional below minimum trade size"),
    INSUFFICIENT_EQUITY("Portfolio equity cannot fund the order"),
    INVALID_ORDER("Order is malformed");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
