package tw.gc.paper.trader.enums;

/**
 * Side of an order or open position.
 */
public enum TradeDirection {
    LONG(1),
    SHORT(-1);

    private final int sign;

    TradeDirection(int sign) {
        this.sign = sign;
    }

    /**
     * +1 for long, -1 for short. P&L = sign * (exit - entry) * quantity.
     */
    public int sign() {
        return sign;
    }

    public TradeDirection opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
