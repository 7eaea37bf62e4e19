package com.spotprice.simulator.domain.service.playback;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "playback")
public class PlaybackProperties {

    private Duration tickInterval = Duration.ofMillis(200);
    private Duration overrunThreshold = Duration.ofSeconds(3);
    private int overrunWarningTicks = 5;
}
