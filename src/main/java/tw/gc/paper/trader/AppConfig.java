package tw.gc.paper.trader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import tw.gc.paper.trader.config.TradingProperties;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public RestTemplate restTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(3000);
        factory.setReadTimeout(5000);
        return new RestTemplate(factory);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Worker pool for candidate backtests. Kept apart from the Spring scheduler threads
     * so a long sweep never occupies the thread that drives live ticks.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService optimizationExecutor(TradingProperties properties) {
        int parallelism = Math.max(1, properties.getOptimization().getParallelism());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "backtest-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("🧪 Optimization executor started with {} workers", parallelism);
        return Executors.newFixedThreadPool(parallelism, factory);
    }
}
