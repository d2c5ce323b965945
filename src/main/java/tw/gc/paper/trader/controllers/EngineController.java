package tw.gc.paper.trader.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.paper.trader.entities.OptimizationResult;
import tw.gc.paper.trader.entities.Trade;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.services.CycleReport;
import tw.gc.paper.trader.services.DriftReport;
import tw.gc.paper.trader.services.EngineStatus;
import tw.gc.paper.trader.services.PerformanceMonitorService;
import tw.gc.paper.trader.services.StrategyOptimizationScheduler;
import tw.gc.paper.trader.services.StrategyRankingService;
import tw.gc.paper.trader.services.TradingEngineService;

import java.util.List;
import java.util.Map;

/**
 * Control surface of the paper trading engine.
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
public class EngineController {

    private final TradingEngineService tradingEngineService;
    private final PerformanceMonitorService performanceMonitorService;
    private final StrategyRankingService strategyRankingService;
    private final StrategyOptimizationScheduler strategyOptimizationScheduler;

    @PostMapping("/start")
    public EngineStatus start() {
        boolean started = tradingEngineService.start();
        log.info("Start requested via API (changed: {})", started);
        return tradingEngineService.status();
    }

    @PostMapping("/stop")
    public EngineStatus stop() {
        boolean stopped = tradingEngineService.stop();
        log.info("Stop requested via API (changed: {})", stopped);
        return tradingEngineService.status();
    }

    @GetMapping("/status")
    public EngineStatus status() {
        return tradingEngineService.status();
    }

    /**
     * @param profile one of default, conservative, aggressive, learning (case-insensitive)
     */
    @PutMapping("/risk-profile/{profile}")
    public ResponseEntity<?> selectRiskProfile(@PathVariable String profile) {
        RiskProfile selected;
        try {
            selected = RiskProfile.fromStringIgnoreCase(profile);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(tradingEngineService.selectRiskProfile(selected));
    }

    @GetMapping("/drift")
    public ResponseEntity<DriftReport> drift() {
        return performanceMonitorService.report()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/winners")
    public List<OptimizationResult> winners() {
        return strategyRankingService.getWinners();
    }

    @GetMapping("/trades")
    public List<Trade> trades(@RequestParam(defaultValue = "50") int limit) {
        List<Trade> trades = tradingEngineService.trades();
        int from = Math.max(0, trades.size() - Math.max(limit, 0));
        return trades.subList(from, trades.size());
    }

    /**
     * Queue an optimization cycle now. Skipped if one is already running.
     */
    @PostMapping("/optimize")
    public ResponseEntity<Map<String, Object>> optimize(
            @RequestParam(defaultValue = "OPTIMIZATION") CycleReport.Trigger trigger) {
        boolean accepted = strategyOptimizationScheduler.trigger(trigger);
        return ResponseEntity.accepted().body(Map.of("trigger", trigger, "accepted", accepted));
    }
}
