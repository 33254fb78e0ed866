package com.jay.fiipulse.config;

import com.jay.fiipulse.layer1_data.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class PulseBeans {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    /** Wall clock in the exchange time zone. */
    @Bean
    public Clock exchangeClock(PulseConfig config) {
        return Clock.system(ZoneId.of(config.calendar().getZone()));
    }
}
