package tw.gc.paper.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.enums.Timeframe;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    private String symbol = "BTCUSDT";
    private Timeframe timeframe = Timeframe.MIN_5;
    private RiskProfile riskProfile = RiskProfile.DEFAULT;

    /**
     * Optional per-profile overrides. Unset fields fall back to the profile's built-in policy.
     */
    private Map<RiskProfile, PolicyOverride> riskOverrides = new EnumMap<>(RiskProfile.class);

    private Engine engine = new Engine();
    private Optimization optimization = new Optimization();
    private Persistence persistence = new Persistence();
    private Monitor monitor = new Monitor();
    private Feed feed = new Feed();

    @Data
    public static class Engine {
        private long tickIntervalMs = 1000;
        private boolean autoStart = true;
        private int lookback = 120;
        private String defaultStrategyFamily = "RSI";
    }

    @Data
    public static class Optimization {
        private boolean enabled = true;
        private long intervalMs = 600_000;
        private long discoveryIntervalMs = 1_800_000;
        private long initialDelayMs = 30_000;
        private double promotionThreshold = 0.75;
        private int winnersToKeep = 5;
        private int perturbationsPerCycle = 8;
        private int discoveryCandidates = 12;
        private int historyDays = 180;
        private int minReplaySamples = 50;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private long seed = 42L;

        /**
         * Extra timeframes each cycle replays the population on. Their results join the winner set,
         * but only live-timeframe results can be promoted. Empty means live timeframe only.
         */
        private List<Timeframe> timeframes = new ArrayList<>();
    }

    @Data
    public static class Persistence {
        private boolean enabled = true;
        private String stateFile = "data/engine-state.json";
    }

    @Data
    public static class Monitor {
        private double driftAlertThreshold = 0.05;
        private int maxSamples = 10_000;
    }

    @Data
    public static class Feed {
        private String historyDir;
        private Binance binance = new Binance();
        private Simulation simulation = new Simulation();
    }

    @Data
    public static class Binance {
        private boolean enabled = false;
        private String baseUrl = "https://api.binance.com";
        private long pollIntervalMs = 5000;
        private int limit = 500;
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private double startPrice = 100_000.0;
        private double volatility = 0.002;
        private long intervalMs = 1000;
        private long seed = 7L;
    }

    @Data
    public static class PolicyOverride {
        private Double startingBalance;
        private Double maxPositionFraction;
        private Double fullConfidenceFraction;
        private Double stopLossPct;
        private Double takeProfitPct;
        private Double minConfidence;
        private Double maxDrawdownPct;
        private Double feeRate;
        private Double minTradeNotional;
        private Boolean flipOnReversal;
        private Double atrStopMultiplier;
        private Double atrTakeMultiplier;
        private Integer atrPeriod;
    }
}
