package de.kherud.upscale.tiling;

import de.kherud.upscale.UpscaleException;
import de.kherud.upscale.image.RasterImage;

import java.util.ArrayList;
import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Splits a source image into a grid of overlapping tiles.
 *
 * Tiles start every {@code step = tileSize - overlap} pixels in both directions, beginning at the
 * origin and continuing while the start lies inside the image. Tiles at the right and bottom edges
 * shrink to the remaining extent, so the grid covers the image exactly and never reads outside it.
 */
public final class TileDecomposer {

	private static final System.Logger LOGGER = System.getLogger(TileDecomposer.class.getName());

	private TileDecomposer() {
		throw new AssertionError("Utility class should not be instantiated");
	}

	/**
	 * Cut {@code image} into tiles.
	 *
	 * @param image source image
	 * @param tileSize nominal tile edge length in pixels
	 * @param overlap pixels shared by neighbouring tiles
	 * @return tiles in row-major order plus the source dimensions
	 * @throws UpscaleException with {@code INVALID_PARAMETER} for a bad tile size or overlap,
	 *                          {@code INVALID_IMAGE} for a missing image
	 */
	public static Decomposition decompose(RasterImage image, int tileSize, int overlap) {
		validate(tileSize, overlap);
		if (image == null) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_IMAGE, "Image cannot be null");
		}

		int width = image.getWidth();
		int height = image.getHeight();
		int step = tileSize - overlap;
		List<Tile> tiles = new ArrayList<>(countTiles(width, height, tileSize, overlap));

		for (int y = 0; y < height; y += step) {
			for (int x = 0; x < width; x += step) {
				int w = Math.min(tileSize, width - x);
				int h = Math.min(tileSize, height - y);
				tiles.add(new Tile(x, y, w, h, image.crop(x, y, w, h)));
			}
		}

		LOGGER.log(DEBUG, String.format("Decomposed %dx%d image into %d tiles (size=%d, overlap=%d, step=%d)",
			width, height, tiles.size(), tileSize, overlap, step));
		return new Decomposition(tiles, width, height);
	}

	/**
	 * Number of tiles {@link #decompose} would produce, computed without copying pixels.
	 */
	public static int countTiles(int width, int height, int tileSize, int overlap) {
		validate(tileSize, overlap);
		if (width <= 0 || height <= 0) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_IMAGE,
				String.format("Image dimensions must be positive, got %dx%d", width, height));
		}
		int step = tileSize - overlap;
		long columns = (width + (long) step - 1) / step;
		long rows = (height + (long) step - 1) / step;
		return (int) Math.min(Integer.MAX_VALUE, columns * rows);
	}

	/**
	 * @throws UpscaleException with {@code INVALID_PARAMETER} unless {@code tileSize > 0} and
	 *                          {@code 0 <= overlap < tileSize}
	 */
	public static void validate(int tileSize, int overlap) {
		if (tileSize <= 0) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER,
				"Tile size must be positive, got " + tileSize);
		}
		if (overlap < 0 || overlap >= tileSize) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER,
				String.format("Overlap must be in [0, %d), got %d", tileSize, overlap));
		}
	}
}
