package com.spotprice.simulator.domain.service.playback;

import com.spotprice.simulator.domain.model.PricePoint;
import com.spotprice.simulator.domain.model.VolatilityRegime;

import java.time.Duration;

public interface PlaybackListener {

    void onPoint(PricePoint point);

    default void onRegimeChange(VolatilityRegime regime, double timestamp) {
    }

    default void onOverrun(Duration lag, int index) {
    }

    void onComplete();

    void onCancelled();
}
