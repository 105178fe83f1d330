package de.kherud.upscale.tiling;

import de.kherud.upscale.image.RasterImage;

/**
 * Rectangular region cut from a source image.
 *
 * {@code x, y, width, height} are in source coordinates. Edge tiles may be smaller than the
 * nominal tile size; they are never padded.
 */
public class Tile {

	private final int x;
	private final int y;
	private final int width;
	private final int height;
	private final RasterImage pixels;

	public Tile(int x, int y, int width, int height, RasterImage pixels) {
		if (pixels == null) {
			throw new IllegalArgumentException("Tile pixels cannot be null");
		}
		if (pixels.getWidth() != width || pixels.getHeight() != height) {
			throw new IllegalArgumentException(String.format(
				"Tile pixels are %dx%d but tile is %dx%d", pixels.getWidth(), pixels.getHeight(), width, height));
		}
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
		this.pixels = pixels;
	}

	public int getX() {
		return x;
	}

	public int getY() {
		return y;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public RasterImage getPixels() {
		return pixels;
	}

	@Override
	public String toString() {
		return String.format("Tile{%dx%d at (%d,%d)}", width, height, x, y);
	}
}
