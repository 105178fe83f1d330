package de.kherud.upscale.tiling;

import de.kherud.upscale.image.RasterImage;

/**
 * A tile together with its enhanced (usually upscaled) pixels.
 *
 * The source-coordinate identity of the originating tile is kept so the merger can project the
 * enhanced buffer back onto the output canvas.
 */
public final class EnhancedTile extends Tile {

	private final RasterImage enhanced;

	public EnhancedTile(Tile source, RasterImage enhanced) {
		super(source.getX(), source.getY(), source.getWidth(), source.getHeight(), source.getPixels());
		if (enhanced == null) {
			throw new IllegalArgumentException("Enhanced pixels cannot be null");
		}
		this.enhanced = enhanced;
	}

	public RasterImage getEnhanced() {
		return enhanced;
	}

	/**
	 * Same tile identity with a replaced enhanced buffer, used by refinement passes.
	 */
	public EnhancedTile withEnhanced(RasterImage replacement) {
		return new EnhancedTile(this, replacement);
	}

	@Override
	public String toString() {
		return String.format("EnhancedTile{%dx%d at (%d,%d) -> %dx%d}", getWidth(), getHeight(), getX(), getY(),
			enhanced.getWidth(), enhanced.getHeight());
	}
}
