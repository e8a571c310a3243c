package com.kuruswap.session;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kuruswap.session")
@NoArgsConstructor
@Getter
@Setter
public class SessionProperties {

    /** Idle conversations are dropped this long after their last transition. */
    private long ttlMinutes = 10;

    private long maxSessions = 100_000;
}
