package tw.gc.paper.trader.services.positionsizing;

import tw.gc.paper.trader.entities.Order;
import tw.gc.paper.trader.enums.RejectionReason;

/**
 * Either a bounded order or the reason no order was produced.
 */
public record SizingDecision(Order order, RejectionReason rejection, String detail) {

    public static SizingDecision accepted(Order order) {
        return new SizingDecision(order, null, null);
    }

    public static SizingDecision rejected(RejectionReason reason, String detail) {
        return new SizingDecision(null, reason, detail);
    }

    public boolean isAccepted() {
        return order != null;
    }
}
