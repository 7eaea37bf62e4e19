package com.spotprice.simulator.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class SimulationParameters {

    @Builder.Default
    private final double maxVolatility = 15.0;

    @Builder.Default
    private final double meanReversionStrength = 0.05;

    @Builder.Default
    private final double jumpFrequency = 2.0;
}
