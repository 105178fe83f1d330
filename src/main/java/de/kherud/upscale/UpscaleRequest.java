package de.kherud.upscale;

import de.kherud.upscale.image.RasterImage;
import de.kherud.upscale.tiling.TileDecomposer;
import org.jetbrains.annotations.Nullable;

/**
 * Parameters of one upscale run.
 *
 * <pre>{@code
 * UpscaleRequest request = UpscaleRequest.builder(image)
 *     .tileSize(256)
 *     .overlap(64)
 *     .upscaleFactor(2.0)
 *     .enhancementPasses(2)
 *     .build();
 * }</pre>
 *
 * Quality knobs and the pass count are clamped on the builder. Tile geometry and scale are
 * checked by {@link #validate()} so that bad values surface as {@code INVALID_PARAMETER}.
 */
public final class UpscaleRequest {

	public static final int DEFAULT_TILE_SIZE = 256;
	public static final int DEFAULT_OVERLAP = 64;
	public static final double DEFAULT_UPSCALE_FACTOR = 2.0;
	public static final String DEFAULT_PROMPT = "enhance detail, keep the original style";
	public static final int MAX_PASSES = 3;

	private final RasterImage image;
	private final int tileSize;
	private final int overlap;
	private final double upscaleFactor;
	private final String prompt;
	private final int enhancementPasses;
	private final int sharpness;
	private final int denoise;
	private final int contrast;
	private final boolean finalPass;
	private final Integer concurrency;

	private UpscaleRequest(Builder builder) {
		this.image = builder.image;
		this.tileSize = builder.tileSize;
		this.overlap = builder.overlap;
		this.upscaleFactor = builder.upscaleFactor;
		this.prompt = builder.prompt;
		this.enhancementPasses = builder.enhancementPasses;
		this.sharpness = builder.sharpness;
		this.denoise = builder.denoise;
		this.contrast = builder.contrast;
		this.finalPass = builder.finalPass;
		this.concurrency = builder.concurrency;
	}

	public static Builder builder(RasterImage image) {
		return new Builder(image);
	}

	/**
	 * @throws UpscaleException with {@code INVALID_PARAMETER} for bad tile geometry, concurrency, or a scale whose
	 *         output canvas would be empty or too large
	 */
	public void validate() {
		TileDecomposer.validate(tileSize, overlap);
		if (!Double.isFinite(upscaleFactor) || upscaleFactor <= 0) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER,
				"Upscale factor must be a positive finite number, got " + upscaleFactor);
		}
		long outputWidth = Math.round(image.getWidth() * upscaleFactor);
		long outputHeight = Math.round(image.getHeight() * upscaleFactor);
		if (outputWidth < 1 || outputHeight < 1) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER, String.format(
				"Upscale factor %s shrinks the %dx%d image to an empty canvas",
				upscaleFactor, image.getWidth(), image.getHeight()));
		}
		// RGBA bytes of the output canvas must fit one array
		if ((double) outputWidth * outputHeight * RasterImage.CHANNELS > Integer.MAX_VALUE) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER, String.format(
				"Upscale factor %s makes the %dx%d image too large (%dx%d)",
				upscaleFactor, image.getWidth(), image.getHeight(), outputWidth, outputHeight));
		}
		if (concurrency != null && concurrency < 1) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER,
				"Concurrency limit must be at least 1, got " + concurrency);
		}
	}

	public RasterImage getImage() {
		return image;
	}

	public int getTileSize() {
		return tileSize;
	}

	public int getOverlap() {
		return overlap;
	}

	public double getUpscaleFactor() {
		return upscaleFactor;
	}

	public String getPrompt() {
		return prompt;
	}

	public int getEnhancementPasses() {
		return enhancementPasses;
	}

	public int getSharpness() {
		return sharpness;
	}

	public int getDenoise() {
		return denoise;
	}

	public int getContrast() {
		return contrast;
	}

	public boolean isFinalPass() {
		return finalPass;
	}

	@Nullable
	public Integer getConcurrency() {
		return concurrency;
	}

	@Override
	public String toString() {
		return String.format("UpscaleRequest{image=%dx%d, tileSize=%d, overlap=%d, scale=%.2f, passes=%d, " +
				"sharpness=%d, denoise=%d, contrast=%d, finalPass=%s}",
			image.getWidth(), image.getHeight(), tileSize, overlap, upscaleFactor, enhancementPasses,
			sharpness, denoise, contrast, finalPass);
	}

	public static class Builder {
		private final RasterImage image;
		private int tileSize = DEFAULT_TILE_SIZE;
		private int overlap = DEFAULT_OVERLAP;
		private double upscaleFactor = DEFAULT_UPSCALE_FACTOR;
		private String prompt = DEFAULT_PROMPT;
		private int enhancementPasses = 1;
		private int sharpness = 50;
		private int denoise = 0;
		private int contrast = 50;
		private boolean finalPass = false;
		private Integer concurrency;

		private Builder(RasterImage image) {
			if (image == null) {
				throw new IllegalArgumentException("Image cannot be null");
			}
			this.image = image;
		}

		public Builder tileSize(int tileSize) {
			this.tileSize = tileSize;
			return this;
		}

		public Builder overlap(int overlap) {
			this.overlap = overlap;
			return this;
		}

		public Builder upscaleFactor(double upscaleFactor) {
			this.upscaleFactor = upscaleFactor;
			return this;
		}

		public Builder prompt(String prompt) {
			this.prompt = prompt == null || prompt.isBlank() ? DEFAULT_PROMPT : prompt;
			return this;
		}

		public Builder enhancementPasses(int passes) {
			this.enhancementPasses = clamp(passes, 1, MAX_PASSES);
			return this;
		}

		public Builder sharpness(int sharpness) {
			this.sharpness = clamp(sharpness, 0, 100);
			return this;
		}

		public Builder denoise(int denoise) {
			this.denoise = clamp(denoise, 0, 100);
			return this;
		}

		public Builder contrast(int contrast) {
			this.contrast = clamp(contrast, 0, 100);
			return this;
		}

		public Builder finalPass(boolean finalPass) {
			this.finalPass = finalPass;
			return this;
		}

		/**
		 * Override the concurrency limit of the upscaler settings for this request.
		 */
		public Builder concurrency(@Nullable Integer concurrency) {
			this.concurrency = concurrency;
			return this;
		}

		public UpscaleRequest build() {
			return new UpscaleRequest(this);
		}

		private static int clamp(int value, int min, int max) {
			return Math.max(min, Math.min(max, value));
		}
	}
}
