package org.lumina.atlas.assembly;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.lumina.atlas.model.Atlas;
import org.lumina.atlas.model.AtlasClass;
import org.lumina.atlas.model.AtlasRegion;
import org.lumina.atlas.model.DecodedRaster;
import org.lumina.atlas.model.DetailLevel;
import org.lumina.atlas.model.PackedRect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws decoded rasters into a fresh square ARGB buffer at their packed rectangles.
 * <p>
 * <strong>Resampling:</strong> a raster whose size equals its placement is copied as is.
 * Reductions by 2× or more on both axes go through {@link AreaAveragingScaler}; every other
 * size change uses bilinear interpolation.
 * <p>
 * <strong>Ownership:</strong> every raster passed in is released before this method returns,
 * drawn or not. A missing or unusable raster leaves its rectangle transparent and its id is
 * reported in {@link AssemblyResult#failed()}.
 * <p>
 * This class is stateless and thread-safe; concurrent calls assemble independent atlases.
 */
public class AtlasAssembler {

    private static final Logger log = LoggerFactory.getLogger(AtlasAssembler.class);

    private static final int AREA_AVERAGING_FACTOR = 2;

    private final AreaAveragingScaler areaScaler;

    public AtlasAssembler() {
        this(new AreaAveragingScaler());
    }

    public AtlasAssembler(final AreaAveragingScaler areaScaler) {
        this.areaScaler = areaScaler;
    }

    /**
     * Composes one atlas.
     *
     * @param rasters     Decoded photos. Each is released by this call.
     * @param placements  Packed rectangles (one per image id).
     * @param atlasSize   Edge length of the atlas buffer.
     * @param detailLevel Level the rectangles were packed at.
     * @param atlasClass  Cache class of the resulting atlas.
     * @param generation  Sequence number stamped onto the atlas.
     * @return The atlas and the ids that could not be drawn.
     */
    public AssemblyResult assemble(final List<DecodedRaster> rasters, final List<PackedRect> placements,
                                   final int atlasSize, final DetailLevel detailLevel,
                                   final AtlasClass atlasClass, final long generation) {
        if (atlasSize <= 0) {
            throw new IllegalArgumentException("Atlas size must be positive, got " + atlasSize);
        }

        final Map<String, DecodedRaster> byId = new LinkedHashMap<>();
        for (final DecodedRaster raster : rasters) {
            final DecodedRaster previous = byId.putIfAbsent(raster.id(), raster);
            if (previous != null && previous != raster) {
                raster.release();
            }
        }

        final BufferedImage image = new BufferedImage(atlasSize, atlasSize, BufferedImage.TYPE_INT_ARGB);
        final int[] buffer = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
        final Map<String, AtlasRegion> regions = new LinkedHashMap<>();
        final List<String> failed = new ArrayList<>();
        final Graphics2D g = image.createGraphics();

        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            for (final PackedRect rect : placements) {
                final DecodedRaster raster = byId.remove(rect.id());
                if (raster == null || !raster.isUsable()) {
                    log.debug("No usable raster for '{}', leaving its rectangle empty", rect.id());
                    failed.add(rect.id());
                    if (raster != null) {
                        raster.release();
                    }
                    continue;
                }
                try {
                    final double aspectRatio = (double) raster.width() / raster.height();
                    draw(g, buffer, atlasSize, raster.image(), rect);
                    regions.put(rect.id(), AtlasRegion.of(rect, aspectRatio, detailLevel));
                } catch (RuntimeException e) {
                    log.warn("Failed to draw '{}' into atlas: {}", rect.id(), e.getMessage());
                    failed.add(rect.id());
                } finally {
                    raster.release();
                }
            }
        } finally {
            g.dispose();
            // Rasters without a placement
            for (final DecodedRaster leftover : byId.values()) {
                leftover.release();
            }
        }

        log.debug("Assembled {} atlas {}px for {}: {} regions, {} failed",
            atlasClass, atlasSize, detailLevel, regions.size(), failed.size());
        return new AssemblyResult(new Atlas(image, regions, detailLevel, atlasClass, generation), failed);
    }

    private void draw(final Graphics2D g, final int[] buffer, final int atlasSize,
                      final BufferedImage source, final PackedRect rect) {
        final int srcW = source.getWidth();
        final int srcH = source.getHeight();

        if (srcW == rect.width() && srcH == rect.height()) {
            source.getRGB(0, 0, srcW, srcH, buffer, rect.y() * atlasSize + rect.x(), atlasSize);
        } else if (srcW >= rect.width() * AREA_AVERAGING_FACTOR && srcH >= rect.height() * AREA_AVERAGING_FACTOR) {
            areaScaler.scaleInto(source, buffer, atlasSize, rect.x(), rect.y(), rect.width(), rect.height());
        } else {
            g.drawImage(source, rect.x(), rect.y(), rect.width(), rect.height(), null);
        }
    }
}
