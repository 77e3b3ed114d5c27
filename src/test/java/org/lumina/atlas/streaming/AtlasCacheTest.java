package org.lumina.atlas.streaming;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.lumina.atlas.model.Atlas;
import org.lumina.atlas.model.AtlasClass;
import org.lumina.atlas.model.AtlasRegion;
import org.lumina.atlas.model.DetailLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("AtlasCache Unit Tests")
class AtlasCacheTest {

    private static final long ATLAS_64_BYTES = 64L * 64 * 4;

    private final AtlasCache cache = new AtlasCache(2);
    private long nextSequence = 1;

    @Test
    @DisplayName("Visible levels roll within the window, oldest evicted first")
    void visibleWindow() {
        install(DetailLevel.LEVEL_1, AtlasClass.VISIBLE, "a");
        install(DetailLevel.LEVEL_2, AtlasClass.VISIBLE, "a");

        AtlasCache.InstallResult result = install(DetailLevel.LEVEL_3, AtlasClass.VISIBLE, "a");

        assertThat(result.installed()).isTrue();
        assertThat(result.evicted()).containsExactly(
            new AtlasCache.Eviction(new TaskKey(DetailLevel.LEVEL_1, AtlasClass.VISIBLE), 1));
        assertThat(cache.snapshot().keySet()).containsExactly(
            new TaskKey(DetailLevel.LEVEL_2, AtlasClass.VISIBLE),
            new TaskKey(DetailLevel.LEVEL_3, AtlasClass.VISIBLE));
    }

    @Test
    @DisplayName("Focused class keeps a single level")
    void focusedSingleLevel() {
        install(DetailLevel.LEVEL_5, AtlasClass.FOCUSED, "f");
        AtlasCache.InstallResult result = install(DetailLevel.LEVEL_6, AtlasClass.FOCUSED, "f");

        assertThat(result.evicted()).hasSize(1);
        assertThat(cache.contains(new TaskKey(DetailLevel.LEVEL_6, AtlasClass.FOCUSED))).isTrue();
        assertThat(cache.contains(new TaskKey(DetailLevel.LEVEL_5, AtlasClass.FOCUSED))).isFalse();
    }

    @Test
    @DisplayName("Install with a revoked token is rejected and leaves the cache untouched")
    void revokedInstallRejected() {
        install(DetailLevel.LEVEL_2, AtlasClass.VISIBLE, "old");
        Map<TaskKey, List<Atlas>> before = cache.snapshot();
        CancellationToken token = new CancellationToken();
        assertThat(cache.revoke(token)).isTrue();

        AtlasCache.InstallResult result = cache.install(new TaskKey(DetailLevel.LEVEL_2, AtlasClass.VISIBLE),
            nextSequence++, List.of(atlas(DetailLevel.LEVEL_2, AtlasClass.VISIBLE, "new")), token);

        assertThat(result.installed()).isFalse();
        assertThat(cache.snapshot()).isSameAs(before);
    }

    @Test
    @DisplayName("A late active result at another level does not replace a newer one")
    void olderSingleLevelInstallRejected() {
        AtlasCache.InstallResult newer = install(3, DetailLevel.LEVEL_4, AtlasClass.ACTIVE, "p2", "p3");
        AtlasCache.InstallResult older = install(2, DetailLevel.LEVEL_3, AtlasClass.ACTIVE, "p0", "p1");

        assertThat(newer.installed()).isTrue();
        assertThat(older.installed()).isFalse();
        assertThat(cache.contains(new TaskKey(DetailLevel.LEVEL_4, AtlasClass.ACTIVE))).isTrue();
        assertThat(cache.contains(new TaskKey(DetailLevel.LEVEL_3, AtlasClass.ACTIVE))).isFalse();
        assertThat(cache.findRegion("p2")).get()
            .extracting(lookup -> lookup.atlas().atlasClass()).isEqualTo(AtlasClass.ACTIVE);
    }

    @Test
    @DisplayName("Visible levels accept older sequences at other levels but not at the same level")
    void visibleSequencePerLevel() {
        install(5, DetailLevel.LEVEL_3, AtlasClass.VISIBLE, "a");

        assertThat(install(4, DetailLevel.LEVEL_2, AtlasClass.VISIBLE, "a").installed()).isTrue();
        assertThat(install(3, DetailLevel.LEVEL_3, AtlasClass.VISIBLE, "b").installed()).isFalse();
        assertThat(cache.findRegion("b")).isEmpty();
    }

    @Test
    @DisplayName("Trimming evicts streamed levels in order and never the persistent set")
    void trimOrder() {
        install(DetailLevel.LEVEL_0, AtlasClass.PERSISTENT, "p");
        install(DetailLevel.LEVEL_1, AtlasClass.VISIBLE, "v1");
        install(DetailLevel.LEVEL_2, AtlasClass.VISIBLE, "v2");
        install(DetailLevel.LEVEL_2, AtlasClass.ACTIVE, "a");
        install(DetailLevel.LEVEL_6, AtlasClass.FOCUSED, "f");

        List<AtlasCache.Eviction> first = cache.trimStreamedTo(3 * ATLAS_64_BYTES);
        assertThat(first).extracting(AtlasCache.Eviction::key)
            .containsExactly(new TaskKey(DetailLevel.LEVEL_1, AtlasClass.VISIBLE));

        List<AtlasCache.Eviction> rest = cache.trimStreamedTo(0);
        assertThat(rest).extracting(AtlasCache.Eviction::key).containsExactly(
            new TaskKey(DetailLevel.LEVEL_2, AtlasClass.ACTIVE),
            new TaskKey(DetailLevel.LEVEL_2, AtlasClass.VISIBLE),
            new TaskKey(DetailLevel.LEVEL_6, AtlasClass.FOCUSED));
        assertThat(cache.streamedBytes()).isZero();
        assertThat(cache.bytesOf(AtlasClass.PERSISTENT)).isEqualTo(ATLAS_64_BYTES);
    }

    @Test
    @DisplayName("Lookup prefers focused, then active, then the highest visible level, then persistent")
    void lookupOrder() {
        install(DetailLevel.LEVEL_0, AtlasClass.PERSISTENT, "x", "only-persistent");
        install(DetailLevel.LEVEL_1, AtlasClass.VISIBLE, "x");
        install(DetailLevel.LEVEL_3, AtlasClass.VISIBLE, "x");

        assertThat(cache.findRegion("x")).get()
            .extracting(lookup -> lookup.region().detailLevel()).isEqualTo(DetailLevel.LEVEL_3);
        assertThat(cache.findRegion("only-persistent")).get()
            .extracting(lookup -> lookup.atlas().atlasClass()).isEqualTo(AtlasClass.PERSISTENT);

        install(DetailLevel.LEVEL_6, AtlasClass.FOCUSED, "x");
        assertThat(cache.findRegion("x")).get()
            .extracting(lookup -> lookup.atlas().atlasClass()).isEqualTo(AtlasClass.FOCUSED);
        assertThat(cache.findRegion("missing")).isEmpty();
    }

    @Test
    @DisplayName("Invalidated atlases are skipped by lookups and reported")
    void invalidatedSkipped() {
        install(DetailLevel.LEVEL_0, AtlasClass.PERSISTENT, "x");
        install(DetailLevel.LEVEL_3, AtlasClass.VISIBLE, "x");
        cache.atlases(new TaskKey(DetailLevel.LEVEL_3, AtlasClass.VISIBLE)).get(0).invalidate();

        assertThat(cache.hasInvalidated(AtlasClass.VISIBLE)).isTrue();
        assertThat(cache.hasInvalidated(AtlasClass.PERSISTENT)).isFalse();
        assertThat(cache.findRegion("x")).get()
            .extracting(lookup -> lookup.atlas().atlasClass()).isEqualTo(AtlasClass.PERSISTENT);
    }

    @Test
    @DisplayName("Clearing a class drops all its levels")
    void clearClass() {
        install(DetailLevel.LEVEL_1, AtlasClass.VISIBLE, "v");
        install(DetailLevel.LEVEL_6, AtlasClass.FOCUSED, "f");

        List<AtlasCache.Eviction> evicted = cache.clear(AtlasClass.FOCUSED);

        assertThat(evicted).hasSize(1);
        assertThat(cache.hasClass(AtlasClass.FOCUSED)).isFalse();
        assertThat(cache.hasClass(AtlasClass.VISIBLE)).isTrue();
    }

    private AtlasCache.InstallResult install(DetailLevel level, AtlasClass atlasClass, String... ids) {
        return install(nextSequence++, level, atlasClass, ids);
    }

    private AtlasCache.InstallResult install(long sequence, DetailLevel level, AtlasClass atlasClass, String... ids) {
        return cache.install(new TaskKey(level, atlasClass), sequence, List.of(atlas(level, atlasClass, ids)),
            new CancellationToken());
    }

    private static Atlas atlas(DetailLevel level, AtlasClass atlasClass, String... ids) {
        Map<String, AtlasRegion> regions = new LinkedHashMap<>();
        int x = 0;
        for (String id : ids) {
            regions.put(id, new AtlasRegion(id, x, 0, 8, 8, 1.0, level));
            x += 10;
        }
        return new Atlas(new BufferedImage(64, 64, BufferedImage.TYPE_INT_ARGB), regions, level, atlasClass, 1);
    }
}
