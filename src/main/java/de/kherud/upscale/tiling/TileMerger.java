package de.kherud.upscale.tiling;

import de.kherud.upscale.enhance.EnhancementCapability;
import de.kherud.upscale.image.RasterImage;

import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Reassembles enhanced tiles into one seamless canvas.
 *
 * <h3>Blending</h3>
 * Each tile is projected to {@code (round(x * scale), round(y * scale))} on the output canvas.
 * On every side where the tile has a neighbour, its weight ramps from 0 at the tile edge to 1 at
 * {@code feather = round(overlap * scale)} pixels inwards along a smoothstep curve
 * {@code 3t^2 - 2t^3}, which has zero slope at both ends of the ramp. Sides on the true image
 * boundary keep weight 1. Horizontal and vertical weights are multiplied and floored at
 * {@link #MIN_WEIGHT} so corner pixels never carry zero weight.
 *
 * <h3>Normalization</h3>
 * Weighted values and weights are summed into float buffers; each output channel is
 * {@code round(clamp(sum / weight, 0, 255))}. A pixel no tile reached divides by 1 and stays
 * transparent black.
 *
 * Merging is a pure accumulation: the result does not depend on tile order and is identical for
 * identical input.
 */
public final class TileMerger {

	static final float MIN_WEIGHT = 1e-4f;

	private static final System.Logger LOGGER = System.getLogger(TileMerger.class.getName());
	private static final int CHANNELS = RasterImage.CHANNELS;

	private TileMerger() {
		throw new AssertionError("Utility class should not be instantiated");
	}

	/**
	 * Merge enhanced tiles into a canvas of {@code round(originalWidth * scale)} by
	 * {@code round(originalHeight * scale)} pixels.
	 *
	 * @param tiles enhanced tiles carrying their source coordinates
	 * @param originalWidth source image width
	 * @param originalHeight source image height
	 * @param tileSize nominal tile size used for decomposition
	 * @param overlap overlap used for decomposition
	 * @param scale upscale factor applied to every tile
	 * @return merged image
	 * @throws IllegalArgumentException for malformed input, including a tile outside the source or an
	 *         enhanced buffer that is not the tile scaled by {@code scale}
	 */
	public static RasterImage merge(List<EnhancedTile> tiles, int originalWidth, int originalHeight,
									int tileSize, int overlap, double scale) {
		if (tiles == null) {
			throw new IllegalArgumentException("Tiles cannot be null");
		}
		if (originalWidth <= 0 || originalHeight <= 0) {
			throw new IllegalArgumentException(
				String.format("Original dimensions must be positive, got %dx%d", originalWidth, originalHeight));
		}
		if (!Double.isFinite(scale) || scale <= 0) {
			throw new IllegalArgumentException("Scale must be a positive finite number, got " + scale);
		}
		if (tileSize <= 0 || overlap < 0 || overlap >= tileSize) {
			throw new IllegalArgumentException(
				String.format("Inconsistent tile geometry: size=%d, overlap=%d", tileSize, overlap));
		}

		int finalWidth = (int) Math.round(originalWidth * scale);
		int finalHeight = (int) Math.round(originalHeight * scale);
		int feather = (int) Math.round(overlap * scale);

		int pixelCount = Math.multiplyExact(finalWidth, finalHeight);
		float[] acc = new float[Math.multiplyExact(pixelCount, CHANNELS)];
		float[] accWeight = new float[pixelCount];

		for (EnhancedTile tile : tiles) {
			if (tile == null) {
				throw new IllegalArgumentException("Tile list contains null");
			}
			checkTile(tile, originalWidth, originalHeight, scale);
			accumulate(tile, originalWidth, originalHeight, scale, feather, finalWidth, finalHeight, acc, accWeight);
		}

		RasterImage merged = normalize(acc, accWeight, finalWidth, finalHeight);
		LOGGER.log(DEBUG, String.format("Merged %d tiles into %dx%d canvas (feather=%d)",
			tiles.size(), finalWidth, finalHeight, feather));
		return merged;
	}

	/**
	 * Hermite smoothstep on {@code t} clamped to [0, 1].
	 */
	static float smoothStep(float t) {
		float c = t < 0 ? 0 : (t > 1 ? 1 : t);
		return c * c * (3 - 2 * c);
	}

	/**
	 * Blend weight of one pixel along one axis.
	 *
	 * @param pos pixel offset inside the tile
	 * @param extent tile extent along the axis
	 * @param feather ramp length in output pixels
	 * @param fadeStart whether a neighbour exists before the tile
	 * @param fadeEnd whether a neighbour exists after the tile
	 */
	static float axisWeight(int pos, int extent, int feather, boolean fadeStart, boolean fadeEnd) {
		float weight = 1f;
		if (feather <= 0) {
			return weight;
		}
		if (fadeStart && pos < feather) {
			weight = Math.min(weight, smoothStep((float) pos / feather));
		}
		if (fadeEnd && pos >= extent - feather) {
			int distFromEnd = extent - 1 - pos;
			weight = Math.min(weight, smoothStep((float) distFromEnd / feather));
		}
		return weight;
	}

	private static void checkTile(EnhancedTile tile, int originalWidth, int originalHeight, double scale) {
		if (tile.getX() < 0 || tile.getY() < 0 || tile.getWidth() <= 0 || tile.getHeight() <= 0
			|| tile.getX() + tile.getWidth() > originalWidth || tile.getY() + tile.getHeight() > originalHeight) {
			throw new IllegalArgumentException(String.format("Tile %dx%d at (%d, %d) lies outside the %dx%d source",
				tile.getWidth(), tile.getHeight(), tile.getX(), tile.getY(), originalWidth, originalHeight));
		}
		RasterImage enhanced = tile.getEnhanced();
		int expectedWidth = EnhancementCapability.scaledSize(tile.getWidth(), scale);
		int expectedHeight = EnhancementCapability.scaledSize(tile.getHeight(), scale);
		if (enhanced.getWidth() != expectedWidth || enhanced.getHeight() != expectedHeight) {
			throw new IllegalArgumentException(String.format(
				"Enhanced tile at (%d, %d) is %dx%d, expected %dx%d for a %dx%d tile at scale %s",
				tile.getX(), tile.getY(), enhanced.getWidth(), enhanced.getHeight(),
				expectedWidth, expectedHeight, tile.getWidth(), tile.getHeight(), scale));
		}
	}

	private static void accumulate(EnhancedTile tile, int originalWidth, int originalHeight, double scale,
								   int feather, int finalWidth, int finalHeight, float[] acc, float[] accWeight) {
		RasterImage enhanced = tile.getEnhanced();
		int tWidth = enhanced.getWidth();
		int tHeight = enhanced.getHeight();
		byte[] src = enhanced.getPixels();

		int targetX = (int) Math.round(tile.getX() * scale);
		int targetY = (int) Math.round(tile.getY() * scale);

		boolean hasLeft = tile.getX() > 0;
		boolean hasRight = tile.getX() + tile.getWidth() < originalWidth;
		boolean hasTop = tile.getY() > 0;
		boolean hasBottom = tile.getY() + tile.getHeight() < originalHeight;

		float[] weightsX = new float[tWidth];
		for (int tx = 0; tx < tWidth; tx++) {
			weightsX[tx] = axisWeight(tx, tWidth, feather, hasLeft, hasRight);
		}

		for (int ty = 0; ty < tHeight; ty++) {
			int y = targetY + ty;
			if (y < 0 || y >= finalHeight) {
				continue;
			}
			float weightY = axisWeight(ty, tHeight, feather, hasTop, hasBottom);

			for (int tx = 0; tx < tWidth; tx++) {
				int x = targetX + tx;
				if (x < 0 || x >= finalWidth) {
					continue;
				}

				float weight = Math.max(MIN_WEIGHT, weightsX[tx] * weightY);
				int dst = y * finalWidth + x;
				int dstBase = dst * CHANNELS;
				int srcBase = (ty * tWidth + tx) * CHANNELS;

				for (int c = 0; c < CHANNELS; c++) {
					acc[dstBase + c] += (src[srcBase + c] & 0xFF) * weight;
				}
				accWeight[dst] += weight;
			}
		}
	}

	private static RasterImage normalize(float[] acc, float[] accWeight, int width, int height) {
		byte[] out = new byte[acc.length];
		for (int i = 0; i < accWeight.length; i++) {
			float w = accWeight[i] > 0 ? accWeight[i] : 1f;
			int base = i * CHANNELS;
			for (int c = 0; c < CHANNELS; c++) {
				int v = Math.round(acc[base + c] / w);
				out[base + c] = (byte) (v < 0 ? 0 : (v > 255 ? 255 : v));
			}
		}
		return RasterImage.wrap(width, height, out);
	}
}
