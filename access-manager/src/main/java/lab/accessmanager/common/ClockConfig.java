package lab.accessmanager.common;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Every timestamp the manager compares (unlock times, ready-at, member activation) is epoch seconds from this clock.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
