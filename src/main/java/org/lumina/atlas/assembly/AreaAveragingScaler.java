package org.lumina.atlas.assembly;

import java.awt.image.BufferedImage;

/**
 * Downscales images by averaging every block of source pixels that maps onto one target pixel.
 * <p>
 * Used for reductions of 2× or more, where bilinear sampling skips source pixels and
 * aliases. Block edges use float scale factors so the whole source is covered even when
 * the ratio is not an integer (e.g., 800 → 300 uses blocks of 2 and 3 pixels).
 * Colour channels are weighted by alpha so transparent pixels do not darken the result.
 * <p>
 * This class is stateless and thread-safe.
 */
public class AreaAveragingScaler {

    /**
     * Scales {@code source} into a new ARGB image.
     */
    public BufferedImage scale(final BufferedImage source, final int targetWidth, final int targetHeight) {
        final BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        final int[] pixels = new int[targetWidth * targetHeight];
        scaleInto(source, pixels, targetWidth, 0, 0, targetWidth, targetHeight);
        target.setRGB(0, 0, targetWidth, targetHeight, pixels, 0, targetWidth);
        return target;
    }

    /**
     * Scales {@code source} directly into a row-major ARGB buffer.
     *
     * @param source       Image to scale.
     * @param dest         Destination pixels (e.g., the data buffer of an atlas).
     * @param destStride   Row length of {@code dest}.
     * @param destX        Left edge of the target rectangle in {@code dest}.
     * @param destY        Top edge of the target rectangle in {@code dest}.
     * @param targetWidth  Target width, at most the source width.
     * @param targetHeight Target height, at most the source height.
     */
    public void scaleInto(final BufferedImage source, final int[] dest, final int destStride,
                          final int destX, final int destY, final int targetWidth, final int targetHeight) {
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw new IllegalArgumentException(String.format(
                "Target size must be positive, got %dx%d", targetWidth, targetHeight));
        }
        final int sourceWidth = source.getWidth();
        final int sourceHeight = source.getHeight();
        if (targetWidth > sourceWidth || targetHeight > sourceHeight) {
            throw new IllegalArgumentException(String.format(
                "Area averaging only reduces: %dx%d -> %dx%d", sourceWidth, sourceHeight, targetWidth, targetHeight));
        }

        final int[] src = source.getRGB(0, 0, sourceWidth, sourceHeight, null, 0, sourceWidth);
        final float scaleX = (float) sourceWidth / targetWidth;
        final float scaleY = (float) sourceHeight / targetHeight;

        for (int ty = 0; ty < targetHeight; ty++) {
            final int y0 = (int) (ty * scaleY);
            final int y1 = Math.max(y0 + 1, Math.min(sourceHeight, (int) ((ty + 1) * scaleY)));
            final int rowBase = (destY + ty) * destStride + destX;

            for (int tx = 0; tx < targetWidth; tx++) {
                final int x0 = (int) (tx * scaleX);
                final int x1 = Math.max(x0 + 1, Math.min(sourceWidth, (int) ((tx + 1) * scaleX)));
                dest[rowBase + tx] = averageBlock(src, sourceWidth, x0, y0, x1, y1);
            }
        }
    }

    private int averageBlock(final int[] src, final int stride, final int x0, final int y0, final int x1, final int y1) {
        long sumA = 0;
        long sumR = 0;
        long sumG = 0;
        long sumB = 0;
        int count = 0;

        for (int y = y0; y < y1; y++) {
            final int base = y * stride;
            for (int x = x0; x < x1; x++) {
                final int argb = src[base + x];
                final int a = argb >>> 24;
                sumA += a;
                sumR += (long) ((argb >> 16) & 0xFF) * a;
                sumG += (long) ((argb >> 8) & 0xFF) * a;
                sumB += (long) (argb & 0xFF) * a;
                count++;
            }
        }

        if (sumA == 0) {
            return 0;
        }
        final int a = (int) ((sumA + count / 2) / count);
        final int r = (int) ((sumR + sumA / 2) / sumA);
        final int g = (int) ((sumG + sumA / 2) / sumA);
        final int b = (int) ((sumB + sumA / 2) / sumA);
        return (a << 24) | (r << 16) | (g << 8) | b;
    }
}
