package com.spotprice.simulator.domain.service.engine;

import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.SimulationParameters;
import com.spotprice.simulator.domain.model.VolatilityRegime;
import org.springframework.stereotype.Component;

import java.util.SplittableRandom;

@Component
public class StochasticPriceEngine {

    public static final double LONG_TERM_MEAN = 100.0;
    public static final double PRICE_FLOOR = 10.0;
    public static final double PRICE_CEILING = 300.0;

    static final double DIFFUSION_SCALE = 0.5;
    static final double JUMP_SCALE = 0.5;
    static final double SECONDS_PER_MINUTE = 60.0;

    public PricePoint step(double timestamp,
                           double currentPrice,
                           VolatilityRegime regime,
                           SimulationParameters parameters,
                           double dt,
                           SplittableRandom random) {
        double drift = (LONG_TERM_MEAN - currentPrice) * parameters.getMeanReversionStrength() * dt;

        double effVol = regime.effectiveVolatility(parameters.getMaxVolatility());
        double diffusion = random.nextGaussian() * effVol * DIFFUSION_SCALE * Math.sqrt(dt);

        double jumpProb = parameters.getJumpFrequency() * regime.getJumpProbabilityMultiplier() * dt / SECONDS_PER_MINUTE;
        boolean jumpOccurs = random.nextDouble() < jumpProb;
        double jumpSize = jumpOccurs ? random.nextGaussian() * JUMP_SCALE * effVol : 0.0;

        double nextPrice = clamp(currentPrice + drift + diffusion + jumpSize);
        return new PricePoint(timestamp, nextPrice, regime, jumpOccurs);
    }

    static double clamp(double price) {
        return Math.max(PRICE_FLOOR, Math.min(PRICE_CEILING, price));
    }
}
