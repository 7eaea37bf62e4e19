package com.spotprice.simulator.domain.service.timeline;

import com.spotprice.simulator.domain.model.SimulationParameters;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {

    private double initialPrice = 100.0;
    private double tickSeconds = 0.2;
    private double durationSeconds = 180.0;
    private double regimeSwitchIntervalSeconds = 30.0;
    private Defaults defaults = new Defaults();

    public int totalTicks() {
        return (int) Math.round(durationSeconds / tickSeconds);
    }

    public SimulationParameters defaultParameters() {
        return SimulationParameters.builder()
                .maxVolatility(defaults.getMaxVolatility())
                .meanReversionStrength(defaults.getMeanReversionStrength())
                .jumpFrequency(defaults.getJumpFrequency())
                .build();
    }

    @Getter
    @Setter
    public static class Defaults {
        private double maxVolatility = 15.0;
        private double meanReversionStrength = 0.05;
        private double jumpFrequency = 2.0;
    }
}
