package tw.gc.paper.trader.indicators;

import tw.gc.paper.trader.entities.PriceSample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Utility class for calculating technical indicators over candle closes.
 * Every method looks only at the tail of the input and returns empty when the input is too short.
 */
public final class TechnicalIndicatorCalculator {

    private TechnicalIndicatorCalculator() {
        throw new AssertionError("Utility class");
    }

    public static List<Double> closes(List<PriceSample> samples) {
        Objects.requireNonNull(samples, "samples");
        List<Double> closes = new ArrayList<>(samples.size());
        for (PriceSample sample : samples) {
            closes.add(sample.getClose());
        }
        return closes;
    }

    public static Optional<Double> simpleMovingAverage(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period) {
            return Optional.empty();
        }
        double sum = 0.0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            sum += prices.get(i);
        }
        return Optional.of(sum / period);
    }

    public static Optional<Double> relativeStrengthIndex(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period + 1) {
            return Optional.empty();
        }
        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            double change = prices.get(i) - prices.get(i - 1);
            if (change > 0) {
                gainSum += change;
            } else {
                lossSum += Math.abs(change);
            }
        }
        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;
        if (avgLoss == 0.0 && avgGain == 0.0) {
            return Optional.of(50.0);
        }
        if (avgLoss == 0.0) {
            return Optional.of(100.0);
        }
        if (avgGain == 0.0) {
            return Optional.of(0.0);
        }
        double rs = avgGain / avgLoss;
        return Optional.of(100.0 - (100.0 / (1.0 + rs)));
    }

    /**
     * MACD line, signal line and histogram for the latest bar, plus the histogram of the bar before
     * so callers can detect a crossover.
     */
    public static Optional<MacdResult> macd(List<Double> prices, int fastPeriod, int slowPeriod, int signalPeriod) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(fastPeriod, "fastPeriod");
        validatePositive(slowPeriod, "slowPeriod");
        validatePositive(signalPeriod, "signalPeriod");
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("fastPeriod must be less than slowPeriod");
        }
        if (prices.size() < slowPeriod + signalPeriod) {
            return Optional.empty();
        }

        List<Double> fastEma = calculateEmaSeries(prices, fastPeriod);
        List<Double> slowEma = calculateEmaSeries(prices, slowPeriod);

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < prices.size(); i++) {
            Double fast = fastEma.get(i);
            Double slow = slowEma.get(i);
            if (fast != null && slow != null) {
                macdSeries.add(fast - slow);
            }
        }

        List<Double> signalSeries = calculateEmaSeries(macdSeries, signalPeriod);
        int last = macdSeries.size() - 1;
        Double signalLine = signalSeries.get(last);
        if (signalLine == null) {
            return Optional.empty();
        }
        double macdLine = macdSeries.get(last);
        double histogram = macdLine - signalLine;
        Double previousSignal = last > 0 ? signalSeries.get(last - 1) : null;
        double previousHistogram = previousSignal == null ? histogram : macdSeries.get(last - 1) - previousSignal;
        return Optional.of(new MacdResult(macdLine, signalLine, histogram, previousHistogram));
    }

    public static Optional<BollingerBands> bollingerBands(List<Double> prices, int period, double stdDevMultiplier) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (stdDevMultiplier <= 0.0) {
            throw new IllegalArgumentException("stdDevMultiplier must be positive");
        }
        if (prices.size() < period) {
            return Optional.empty();
        }
        List<Double> window = prices.subList(prices.size() - period, prices.size());
        double mean = average(window);
        double stdDev = standardDeviation(window, mean);
        double upper = mean + stdDevMultiplier * stdDev;
        double lower = mean - stdDevMultiplier * stdDev;
        return Optional.of(new BollingerBands(mean, upper, lower, stdDev));
    }

    /**
     * Average true range over the last {@code period} candles (simple average of true ranges).
     */
    public static Optional<Double> averageTrueRange(List<PriceSample> samples, int period) {
        Objects.requireNonNull(samples, "samples");
        validatePositive(period, "period");
        if (samples.size() < period + 1) {
            return Optional.empty();
        }
        double sum = 0.0;
        for (int i = samples.size() - period; i < samples.size(); i++) {
            PriceSample current = samples.get(i);
            double previousClose = samples.get(i - 1).getClose();
            double trueRange = Math.max(current.getHigh() - current.getLow(),
                    Math.max(Math.abs(current.getHigh() - previousClose), Math.abs(current.getLow() - previousClose)));
            sum += trueRange;
        }
        return Optional.of(sum / period);
    }

    /**
     * Rate of change between the latest close and the close {@code period} bars earlier, as a fraction.
     */
    public static Optional<Double> rateOfChange(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period + 1) {
            return Optional.empty();
        }
        double past = prices.get(prices.size() - 1 - period);
        if (past == 0.0) {
            return Optional.empty();
        }
        return Optional.of((prices.get(prices.size() - 1) - past) / past);
    }

    private static void validatePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static double average(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double standardDeviation(List<Double> values, double mean) {
        double variance = 0.0;
        for (double value : values) {
            double diff = value - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / values.size());
    }

    private static List<Double> calculateEmaSeries(List<Double> prices, int period) {
        List<Double> emaSeries = new ArrayList<>(Collections.nCopies(prices.size(), null));
        if (prices.size() < period) {
            return emaSeries;
        }
        double k = 2.0 / (period + 1.0);
        double ema = average(prices.subList(0, period));
        emaSeries.set(period - 1, ema);
        for (int i = period; i < prices.size(); i++) {
            ema = (prices.get(i) * k) + (ema * (1.0 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }

    public record BollingerBands(double middle, double upper, double lower, double stdDev) {
        public BollingerBands {
            if (stdDev < 0.0) {
                throw new IllegalArgumentException("stdDev must be non-negative");
            }
        }
    }

    public record MacdResult(double macdLine, double signalLine, double histogram, double previousHistogram) {

        public boolean crossedUp() {
            return previousHistogram <= 0 && histogram > 0;
        }

        public boolean crossedDown() {
            return previousHistogram >= 0 && histogram < 0;
        }
    }
}
