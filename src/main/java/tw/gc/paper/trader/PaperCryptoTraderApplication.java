package tw.gc.paper.trader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@SpringBootApplication
@EnableScheduling
public class PaperCryptoTraderApplication {

    static {
        // Exchange candles are stamped in UTC; keep every LocalDateTime on the same clock
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
    }

    public static void main(String[] args) {
        SpringApplication.run(PaperCryptoTraderApplication.class, args);
    }
}
