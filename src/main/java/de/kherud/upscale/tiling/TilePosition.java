package de.kherud.upscale.tiling;

/**
 * Human-readable position of a tile within its image, derived from the tile centroid against the
 * image thirds: {@code "center"}, {@code "left side"}, {@code "top center"},
 * {@code "bottom-right corner"} and so on.
 */
public final class TilePosition {

	private TilePosition() {
		throw new AssertionError("Utility class should not be instantiated");
	}

	public static String describe(Tile tile, int imageWidth, int imageHeight) {
		return describe(tile.getX(), tile.getY(), tile.getWidth(), tile.getHeight(), imageWidth, imageHeight);
	}

	public static String describe(int x, int y, int width, int height, int imageWidth, int imageHeight) {
		double centerX = x + width / 2.0;
		double centerY = y + height / 2.0;

		String horizontal = centerX < imageWidth / 3.0 ? "left"
			: centerX > imageWidth * 2 / 3.0 ? "right" : "center";
		String vertical = centerY < imageHeight / 3.0 ? "top"
			: centerY > imageHeight * 2 / 3.0 ? "bottom" : "middle";

		if ("center".equals(horizontal) && "middle".equals(vertical)) {
			return "center";
		}
		if ("middle".equals(vertical)) {
			return horizontal + " side";
		}
		if ("center".equals(horizontal)) {
			return vertical + " center";
		}
		return vertical + "-" + horizontal + " corner";
	}
}
