package at.sv.celestial.position;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnglesTest {

    @Test
    void normalizeDegrees_wrapsIntoPositiveRange() {
        assertThat(Angles.normalizeDegrees(360.0)).isEqualTo(0.0);
        assertThat(Angles.normalizeDegrees(-10.0)).isCloseTo(350.0, within(1e-12));
        assertThat(Angles.normalizeDegrees(725.5)).isCloseTo(5.5, within(1e-12));
        assertThat(Angles.normalizeDegrees(-1e-15)).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
    }

    @Test
    void normalizeSignedDegrees_wrapsIntoSymmetricRange() {
        assertThat(Angles.normalizeSignedDegrees(190.0)).isCloseTo(-170.0, within(1e-12));
        assertThat(Angles.normalizeSignedDegrees(-190.0)).isCloseTo(170.0, within(1e-12));
        assertThat(Angles.normalizeSignedDegrees(180.0)).isCloseTo(-180.0, within(1e-12));
        assertThat(Angles.normalizeSignedDegrees(45.0)).isCloseTo(45.0, within(1e-12));
    }
}
