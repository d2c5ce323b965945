package tw.gc.paper.trader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.enums.RiskProfile;
import tw.gc.paper.trader.enums.Timeframe;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds the packaged application.yml the way Spring Boot does at startup.
 */
class ApplicationConfigurationTest {

    private Binder binder;

    @BeforeEach
    void setUp() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        binder = new Binder(ConfigurationPropertySources.from(sources), new PropertySourcesPlaceholdersResolver(sources));
    }

    @Test
    void tradingDefaults_shouldBindFromYaml() {
        TradingProperties properties = binder.bind("trading", TradingProperties.class).get();

        assertEquals("BTCUSDT", properties.getSymbol());
        assertEquals(Timeframe.MIN_5, properties.getTimeframe());
        assertEquals(RiskProfile.DEFAULT, properties.getRiskProfile());
        assertEquals(120, properties.getEngine().getLookback());
        assertEquals(0.75, properties.getOptimization().getPromotionThreshold());
        assertEquals(List.of(Timeframe.MIN_15, Timeframe.HOUR_1, Timeframe.HOUR_4, Timeframe.DAY_1),
                properties.getOptimization().getTimeframes());
        assertEquals("data/engine-state.json", properties.getPersistence().getStateFile());
        assertFalse(properties.getFeed().getBinance().isEnabled());
        assertTrue(properties.getFeed().getSimulation().isEnabled());
    }

    @Test
    void logging_shouldRollDailyWithCaps() {
        assertEquals("logs/paper-trader.log", binder.bind("logging.file.name", String.class).get());
        assertEquals("10MB", binder.bind("logging.logback.rollingpolicy.max-file-size", String.class).get());
        assertEquals(30, binder.bind("logging.logback.rollingpolicy.max-history", Integer.class).get());
        assertEquals("500MB", binder.bind("logging.logback.rollingpolicy.total-size-cap", String.class).get());
    }
}
