package de.kherud.upscale.tiling;

import java.util.Collections;
import java.util.List;

/**
 * Result of {@link TileDecomposer#decompose}: the tiles in row-major order and the source size.
 */
public final class Decomposition {

	private final List<Tile> tiles;
	private final int imageWidth;
	private final int imageHeight;

	Decomposition(List<Tile> tiles, int imageWidth, int imageHeight) {
		this.tiles = Collections.unmodifiableList(tiles);
		this.imageWidth = imageWidth;
		this.imageHeight = imageHeight;
	}

	public List<Tile> getTiles() {
		return tiles;
	}

	public int getImageWidth() {
		return imageWidth;
	}

	public int getImageHeight() {
		return imageHeight;
	}

	public int size() {
		return tiles.size();
	}
}
