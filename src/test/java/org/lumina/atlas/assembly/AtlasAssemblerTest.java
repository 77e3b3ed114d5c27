package org.lumina.atlas.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lumina.atlas.testsupport.SyntheticPhotoLoader.solid;

import java.util.List;

import org.lumina.atlas.model.AtlasClass;
import org.lumina.atlas.model.AtlasRegion;
import org.lumina.atlas.model.DecodedRaster;
import org.lumina.atlas.model.DetailLevel;
import org.lumina.atlas.model.PackedRect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AtlasAssembler}.
 */
@Tag("unit")
@DisplayName("AtlasAssembler Unit Tests")
class AtlasAssemblerTest {

    private static final int BLUE = 0xFF0000FF;
    private static final int GREEN = 0xFF00FF00;

    private AtlasAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new AtlasAssembler();
    }

    @Nested
    @DisplayName("Drawing")
    class DrawingTests {

        @Test
        @DisplayName("Same-size raster is copied to its rectangle")
        void exactSize_copied() {
            DecodedRaster raster = solid("a", 10, 10, BLUE);

            AssemblyResult result = assembler.assemble(List.of(raster),
                List.of(new PackedRect("a", 2, 2, 10, 10)), 64, DetailLevel.LEVEL_0, AtlasClass.VISIBLE, 3);

            assertThat(result.failed()).isEmpty();
            assertThat(result.atlas().size()).isEqualTo(64);
            assertThat(result.atlas().generation()).isEqualTo(3);
            assertThat(result.atlas().image().getRGB(2, 2)).isEqualTo(BLUE);
            assertThat(result.atlas().image().getRGB(11, 11)).isEqualTo(BLUE);
            assertThat(result.atlas().image().getRGB(1, 1)).isZero();
            assertThat(result.atlas().image().getRGB(12, 12)).isZero();
        }

        @Test
        @DisplayName("Smaller raster is scaled up with bilinear interpolation")
        void upscale_bilinear() {
            AssemblyResult result = assembler.assemble(List.of(solid("a", 5, 5, GREEN)),
                List.of(new PackedRect("a", 0, 0, 10, 10)), 32, DetailLevel.LEVEL_0, AtlasClass.VISIBLE, 1);

            assertThat(result.atlas().image().getRGB(5, 5)).isEqualTo(GREEN);
            assertThat(result.atlas().image().getRGB(20, 20)).isZero();
        }

        @Test
        @DisplayName("Raster at least twice as large is area-averaged")
        void largeReduction_areaAveraged() {
            AssemblyResult result = assembler.assemble(List.of(solid("a", 40, 40, GREEN)),
                List.of(new PackedRect("a", 4, 4, 10, 10)), 32, DetailLevel.LEVEL_0, AtlasClass.VISIBLE, 1);

            assertThat(result.atlas().image().getRGB(4, 4)).isEqualTo(GREEN);
            assertThat(result.atlas().image().getRGB(13, 13)).isEqualTo(GREEN);
            assertThat(result.atlas().image().getRGB(14, 14)).isZero();
        }

        @Test
        @DisplayName("Region aspect ratio comes from the decoded raster")
        void aspectRatio_fromRaster() {
            AssemblyResult result = assembler.assemble(List.of(solid("a", 30, 10, BLUE)),
                List.of(new PackedRect("a", 0, 0, 30, 10)), 64, DetailLevel.LEVEL_1, AtlasClass.ACTIVE, 1);

            AtlasRegion region = result.atlas().region("a").orElseThrow();
            assertThat(region.aspectRatio()).isEqualTo(3.0);
            assertThat(region.detailLevel()).isEqualTo(DetailLevel.LEVEL_1);
            assertThat(result.atlas().atlasClass()).isEqualTo(AtlasClass.ACTIVE);
        }
    }

    @Nested
    @DisplayName("Failures and ownership")
    class FailureTests {

        @Test
        @DisplayName("Missing raster leaves the rectangle transparent")
        void missingRaster_failed() {
            AssemblyResult result = assembler.assemble(List.of(solid("a", 8, 8, BLUE)),
                List.of(new PackedRect("a", 0, 0, 8, 8), new PackedRect("b", 10, 0, 8, 8)),
                32, DetailLevel.LEVEL_0, AtlasClass.VISIBLE, 1);

            assertThat(result.failed()).containsExactly("b");
            assertThat(result.atlas().regions()).containsOnlyKeys("a");
            assertThat(result.atlas().image().getRGB(12, 2)).isZero();
        }

        @Test
        @DisplayName("Already released raster counts as corrupt")
        void releasedRaster_failed() {
            DecodedRaster raster = solid("a", 8, 8, BLUE);
            raster.release();

            AssemblyResult result = assembler.assemble(List.of(raster),
                List.of(new PackedRect("a", 0, 0, 8, 8)), 32, DetailLevel.LEVEL_0, AtlasClass.VISIBLE, 1);

            assertThat(result.failed()).containsExactly("a");
            assertThat(result.atlas().regions()).isEmpty();
        }

        @Test
        @DisplayName("Every raster is released, placed or not")
        void allRastersReleased() {
            DecodedRaster placed = solid("a", 8, 8, BLUE);
            DecodedRaster unplaced = solid("z", 8, 8, BLUE);

            assembler.assemble(List.of(placed, unplaced), List.of(new PackedRect("a", 0, 0, 8, 8)),
                32, DetailLevel.LEVEL_0, AtlasClass.VISIBLE, 1);

            assertThat(placed.isUsable()).isFalse();
            assertThat(unplaced.isUsable()).isFalse();
        }
    }
}
