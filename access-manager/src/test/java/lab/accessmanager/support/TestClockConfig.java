package lab.accessmanager.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class TestClockConfig {

    public static final long START = 1_700_000_000L;

    @Bean
    @Primary
    MutableClock testClock() {
        return new MutableClock(START);
    }
}
