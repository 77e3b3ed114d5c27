package org.lumina.atlas.packing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.lumina.atlas.model.PackedRect;
import org.lumina.atlas.model.PlanImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ShelfPacker}.
 */
@Tag("unit")
@DisplayName("ShelfPacker Unit Tests")
class ShelfPackerTest {

    private ShelfPacker packer;

    @BeforeEach
    void setUp() {
        packer = new ShelfPacker();
    }

    @Nested
    @DisplayName("Placement")
    class PlacementTests {

        @Test
        @DisplayName("Seven 128px squares fill one shelf of a 2048 atlas")
        void sevenSquares_singleShelf() {
            List<PlanImage> images = squares(7, 128);

            PackResult result = packer.pack(images, 2048, 2);

            assertThat(result.rejected()).isEmpty();
            assertThat(result.placed()).hasSize(7);
            for (int i = 0; i < 7; i++) {
                PackedRect rect = result.placed().get(i);
                assertThat(rect.id()).isEqualTo("img-" + i);
                assertThat(rect.x()).isEqualTo(2 + i * 132);
                assertThat(rect.y()).isEqualTo(2);
                assertThat(rect.width()).isEqualTo(128);
                assertThat(rect.height()).isEqualTo(128);
            }
            assertThat(result.utilization()).isCloseTo(7.0 * 128 * 128 / (2048.0 * 2048), within(1e-9));
            assertThat(result.utilization()).isCloseTo(0.027, within(0.001));
        }

        @Test
        @DisplayName("Taller images go first and shorter ones reuse the shelf")
        void sortsByHeightDescending() {
            List<PlanImage> images = List.of(
                PlanImage.exact("short", 50, 40),
                PlanImage.exact("tall", 50, 100));

            PackResult result = packer.pack(images, 256, 0);

            assertThat(result.placed()).extracting(PackedRect::id).containsExactly("tall", "short");
            assertThat(result.placed().get(1).y()).isZero();
            assertThat(result.placed().get(1).x()).isEqualTo(50);
        }

        @Test
        @DisplayName("Equal heights keep input order")
        void ties_keepInputOrder() {
            List<PlanImage> images = List.of(
                PlanImage.exact("c", 30, 60),
                PlanImage.exact("a", 40, 60),
                PlanImage.exact("b", 20, 60));

            PackResult result = packer.pack(images, 512, 1);

            assertThat(result.placed()).extracting(PackedRect::id).containsExactly("c", "a", "b");
        }

        @Test
        @DisplayName("A new shelf opens below when the row is full")
        void opensNewShelf() {
            List<PlanImage> images = squares(3, 100);

            PackResult result = packer.pack(images, 250, 0);

            assertThat(result.placed()).hasSize(2 + 1);
            assertThat(result.placed().get(2).x()).isZero();
            assertThat(result.placed().get(2).y()).isEqualTo(100);
        }

        @Test
        @DisplayName("Earlier shelves are reused when tall enough")
        void firstFit_reusesEarlierShelf() {
            List<PlanImage> images = List.of(
                PlanImage.exact("wide-tall", 180, 100),
                PlanImage.exact("mid", 150, 80),
                PlanImage.exact("small", 60, 50));

            PackResult result = packer.pack(images, 250, 0);

            PackedRect small = result.placed().stream().filter(r -> r.id().equals("small")).findFirst().orElseThrow();
            assertThat(small.y()).isZero();
            assertThat(small.x()).isEqualTo(180);
        }
    }

    @Nested
    @DisplayName("Rejection")
    class RejectionTests {

        @Test
        @DisplayName("Image larger than atlas minus padding is rejected")
        void oversized_isRejected() {
            PackResult result = packer.pack(List.of(
                PlanImage.exact("too-wide", 2045, 10),
                PlanImage.exact("just-fits", 2044, 10)), 2048, 2);

            assertThat(result.rejected()).extracting(PlanImage::id).containsExactly("too-wide");
            assertThat(result.placed()).extracting(PackedRect::id).containsExactly("just-fits");
        }

        @Test
        @DisplayName("Images beyond the atlas height are rejected")
        void full_rejectsRemainder() {
            PackResult result = packer.pack(squares(10, 256), 512, 0);

            assertThat(result.placed()).hasSize(4);
            assertThat(result.rejected()).hasSize(6);
            assertThat(result.utilization()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("Invalid arguments throw IllegalArgumentException")
        void invalidArguments() {
            assertThatThrownBy(() -> packer.pack(List.of(), 0, 2))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> packer.pack(List.of(), 1024, -1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Empty input yields empty result")
        void emptyInput() {
            PackResult result = packer.pack(List.of(), 1024, 2);

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.utilization()).isZero();
        }
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("Random input: padded rectangles never overlap and stay inside the atlas")
        void randomInput_noOverlapAndContained() {
            Random random = new Random(42);
            List<PlanImage> images = new ArrayList<>();
            for (int i = 0; i < 300; i++) {
                images.add(PlanImage.exact("p" + i, 10 + random.nextInt(200), 10 + random.nextInt(200)));
            }
            int padding = 3;

            PackResult result = packer.pack(images, 2048, padding);

            assertThat(result.placed().size() + result.rejected().size()).isEqualTo(images.size());
            List<PackedRect> placed = result.placed();
            for (int i = 0; i < placed.size(); i++) {
                PackedRect a = placed.get(i);
                assertThat(a.x()).isGreaterThanOrEqualTo(padding);
                assertThat(a.y()).isGreaterThanOrEqualTo(padding);
                assertThat(a.right() + padding).isLessThanOrEqualTo(2048);
                assertThat(a.bottom() + padding).isLessThanOrEqualTo(2048);
                for (int j = i + 1; j < placed.size(); j++) {
                    PackedRect b = placed.get(j);
                    assertThat(a.paddedIntersects(b, 0))
                        .as("%s overlaps %s", a, b)
                        .isFalse();
                    // Grown by padding on each side, neighbours may touch but never overlap
                    assertThat(new PackedRect(a.id(), a.x() - padding, a.y() - padding,
                        a.width() + 2 * padding, a.height() + 2 * padding)
                        .paddedIntersects(new PackedRect(b.id(), b.x() - padding, b.y() - padding,
                            b.width() + 2 * padding, b.height() + 2 * padding), 0))
                        .isFalse();
                }
            }
        }

        @Test
        @DisplayName("Identical inputs give identical outputs")
        void deterministic() {
            Random random = new Random(7);
            List<PlanImage> images = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                images.add(PlanImage.exact("p" + i, 1 + random.nextInt(300), 1 + random.nextInt(300)));
            }

            PackResult first = packer.pack(images, 1024, 2);
            PackResult second = new ShelfPacker().pack(new ArrayList<>(images), 1024, 2);

            assertThat(second).isEqualTo(first);
        }
    }

    private static List<PlanImage> squares(int count, int side) {
        List<PlanImage> images = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            images.add(PlanImage.exact("img-" + i, side, side));
        }
        return images;
    }
}
