package com.boilerplate.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time source for everything that is compared across requests: token {@code iat}/{@code exp}
 * written at login and checked by the request gate, and the audit columns of persisted rows.
 * All of them are UTC instants, so a token issued by one node validates on another regardless
 * of host time zone. Tests replace this bean with {@link Clock#fixed}.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock systemUtcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
