package tw.gc.paper.trader.entities;

import java.time.LocalDateTime;

public record EquityPoint(LocalDateTime timestamp, double equity) {
}
