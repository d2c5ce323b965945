package tw.gc.paper.trader.services;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.entities.PortfolioSnapshot;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.strategy.TradeSignal;

import java.time.Duration;
import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class EngineStatus {

    boolean running;
    RiskProfile riskProfile;
    PortfolioSnapshot portfolio;
    String activeStrategyId;
    double activeScore;
    TradeSignal lastSignal;
    LocalDateTime startedAt;
    Duration uptime;
    long ticksProcessed;
    long ticksSkipped;
    CycleReport lastCycle;
}
