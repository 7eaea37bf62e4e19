package com.spotprice.simulator.infra.disruptor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "display")
public class DisplayProperties {

    private int bufferSize = 1024;
}
