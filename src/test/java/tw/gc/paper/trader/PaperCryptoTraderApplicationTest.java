package tw.gc.paper.trader;

import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockStatic;

class PaperCryptoTraderApplicationTest {

    @Test
    void main_shouldInvokeSpringApplicationRun() {
        try (MockedStatic<SpringApplication> springApplication = mockStatic(SpringApplication.class)) {
            springApplication.when(() -> SpringApplication.run(eq(PaperCryptoTraderApplication.class), any(String[].class)))
                    .thenReturn(null);

            PaperCryptoTraderApplication.main(new String[]{"--test"});

            springApplication.verify(() -> SpringApplication.run(eq(PaperCryptoTraderApplication.class), any(String[].class)));
        }
        assertEquals("UTC", TimeZone.getDefault().getID());
    }
}
