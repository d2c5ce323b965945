package tw.gc.paper.trader.entities;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.paper.trader.enums.RiskProfile;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything needed to resume the engine after a restart: the live portfolio,
 * the active strategy and the recent price window its signals depend on.
 */
@Value
@Builder
@Jacksonized
public class EngineState {

    int schemaVersion;
    LocalDateTime savedAt;
    RiskProfile riskProfile;
    double startingBalance;
    double cash;
    Double lastPrice;
    Position openPosition;
    List<Trade> trades;
    List<EquityPoint> equityCurve;
    StrategyDefinition activeStrategy;
    double activeScore;
    List<PriceSample> recentSamples;
    long discoverySequence;
}
