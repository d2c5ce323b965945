package tw.gc.paper.trader.services.ledger;

import tw.gc.paper.trader.entities.Position;
import tw.gc.paper.trader.enums.RejectionReason;

public record LedgerResult(boolean accepted, Position position, RejectionReason reason, String detail) {

    public static LedgerResult accepted(Position position) {
        return new LedgerResult(true, position, null, null);
    }

    public static LedgerResult rejected(RejectionReason reason, String detail) {
        return new LedgerResult(false, null, reason, detail);
    }
}
