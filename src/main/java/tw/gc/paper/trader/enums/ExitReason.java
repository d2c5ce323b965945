package tw.gc.paper.trader.enums;

public enum ExitReason {
    STOP_LOSS,
    TAKE_PROFIT,
    EXIT_SIGNAL,
    MANUAL
}
