package org.lumina.atlas.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("Atlas Unit Tests")
class AtlasTest {

    @Test
    @DisplayName("Reports memory, utilization and regions")
    void basics() {
        AtlasRegion region = new AtlasRegion("a", 2, 2, 64, 32, 2.0, DetailLevel.LEVEL_1);
        Atlas atlas = new Atlas(new BufferedImage(128, 128, BufferedImage.TYPE_INT_ARGB),
            Map.of("a", region), DetailLevel.LEVEL_1, AtlasClass.VISIBLE, 5);

        assertThat(atlas.size()).isEqualTo(128);
        assertThat(atlas.memoryBytes()).isEqualTo(128L * 128 * 4);
        assertThat(atlas.utilization()).isEqualTo(64.0 * 32 / (128 * 128));
        assertThat(atlas.region("a")).contains(region);
        assertThat(atlas.region("b")).isEmpty();
        assertThat(atlas.generation()).isEqualTo(5);
    }

    @Test
    @DisplayName("Invalidation is one-way and reported once")
    void invalidate_once() {
        Atlas atlas = new Atlas(new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB),
            Map.of(), DetailLevel.LEVEL_0, AtlasClass.PERSISTENT, 1);

        assertThat(atlas.invalidate()).isTrue();
        assertThat(atlas.invalidate()).isFalse();
        assertThat(atlas.isInvalidated()).isTrue();
    }

    @Test
    @DisplayName("Non-square buffers are rejected")
    void nonSquare_rejected() {
        assertThatThrownBy(() -> new Atlas(new BufferedImage(16, 8, BufferedImage.TYPE_INT_ARGB),
            Map.of(), DetailLevel.LEVEL_0, AtlasClass.VISIBLE, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Released raster is no longer usable")
    void decodedRaster_release() {
        DecodedRaster raster = new DecodedRaster("a", new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB));

        assertThat(raster.isUsable()).isTrue();
        raster.release();
        raster.release();
        assertThat(raster.isUsable()).isFalse();
        assertThat(raster.width()).isZero();
    }
}
