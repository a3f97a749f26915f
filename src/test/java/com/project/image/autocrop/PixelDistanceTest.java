package com.project.image.autocrop;

import com.project.image.autocrop.service.PixelDistance;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PixelDistanceTest {

    @Test
    void identicalPixels_haveZeroDistance() {
        assertThat(PixelDistance.distance(0xFF336699, 0xFF336699)).isZero();
    }

    @Test
    void blackAndWhite_areAtMaximumDistance() {
        assertThat(PixelDistance.distance(0xFF000000, 0xFFFFFFFF)).isEqualTo(1.0);
    }

    @Test
    void alphaChannel_isIgnored() {
        assertThat(PixelDistance.distance(0x00102030, 0xFF102030)).isZero();
    }

    @Test
    void singleChannel_isNormalizedByThreeTimes255Squared() {
        // full red difference only: 255^2 / 195075 = 1/3
        assertThat(PixelDistance.distance(0xFFFF0000, 0xFF000000)).isCloseTo(1.0 / 3.0, within(1e-12));
        // 10 on each channel: 300 / 195075
        assertThat(PixelDistance.distance(0xFF0A0A0A, 0xFF000000)).isCloseTo(300.0 / 195075.0, within(1e-12));
    }

    @Test
    void distance_isSymmetric() {
        assertThat(PixelDistance.distance(0xFF123456, 0xFF654321))
                .isEqualTo(PixelDistance.distance(0xFF654321, 0xFF123456));
    }
}
