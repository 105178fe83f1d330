package de.kherud.upscale.postprocess;

/**
 * Options of the post-processing stage. Out-of-range amounts are clamped, never rejected.
 *
 * <pre>{@code
 * PostProcessOptions options = PostProcessOptions.builder()
 *     .sharpen(true).sharpenAmount(0.5)
 *     .denoise(true).denoiseAmount(40)
 *     .build();
 * }</pre>
 */
public final class PostProcessOptions {

	private final boolean antiBlock;
	private final boolean sharpen;
	private final double sharpenAmount;
	private final boolean denoise;
	private final double denoiseAmount;
	private final boolean enhanceContrast;
	private final double contrastAmount;

	private PostProcessOptions(Builder builder) {
		this.antiBlock = builder.antiBlock;
		this.sharpen = builder.sharpen;
		this.sharpenAmount = builder.sharpenAmount;
		this.denoise = builder.denoise;
		this.denoiseAmount = builder.denoiseAmount;
		this.enhanceContrast = builder.enhanceContrast;
		this.contrastAmount = builder.contrastAmount;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Anti-block smoothing only.
	 */
	public static PostProcessOptions defaults() {
		return builder().build();
	}

	/**
	 * Options derived from the 0..100 quality knobs of an upscale request.
	 *
	 * Sharpening starts above 10, denoising above 20, and the saturation trim only when contrast
	 * moves notably away from the neutral 50.
	 */
	public static PostProcessOptions fromQualityKnobs(int sharpness, int denoise, int contrast) {
		return builder()
			.antiBlock(true)
			.sharpen(sharpness > 10)
			.sharpenAmount(Math.min(1.0, sharpness / 100.0))
			.denoise(denoise > 20)
			.denoiseAmount(denoise)
			.enhanceContrast(contrast > 55 || contrast < 45)
			.contrastAmount(contrast / 50.0)
			.build();
	}

	public boolean isAntiBlock() {
		return antiBlock;
	}

	public boolean isSharpen() {
		return sharpen;
	}

	/** Sharpening strength in [0, 1]. */
	public double getSharpenAmount() {
		return sharpenAmount;
	}

	public boolean isDenoise() {
		return denoise;
	}

	/** Denoise strength in [0, 100]. */
	public double getDenoiseAmount() {
		return denoiseAmount;
	}

	public boolean isEnhanceContrast() {
		return enhanceContrast;
	}

	/** Contrast amount in [0, 2], 1 is neutral. */
	public double getContrastAmount() {
		return contrastAmount;
	}

	@Override
	public String toString() {
		return String.format("PostProcessOptions{antiBlock=%s, sharpen=%s(%.2f), denoise=%s(%.0f), contrast=%s(%.2f)}",
			antiBlock, sharpen, sharpenAmount, denoise, denoiseAmount, enhanceContrast, contrastAmount);
	}

	public static class Builder {
		private boolean antiBlock = true;
		private boolean sharpen = false;
		private double sharpenAmount = 0.5;
		private boolean denoise = false;
		private double denoiseAmount = 0;
		private boolean enhanceContrast = false;
		private double contrastAmount = 1.0;

		public Builder antiBlock(boolean antiBlock) {
			this.antiBlock = antiBlock;
			return this;
		}

		public Builder sharpen(boolean sharpen) {
			this.sharpen = sharpen;
			return this;
		}

		public Builder sharpenAmount(double amount) {
			this.sharpenAmount = clamp(amount, 0, 1);
			return this;
		}

		public Builder denoise(boolean denoise) {
			this.denoise = denoise;
			return this;
		}

		public Builder denoiseAmount(double amount) {
			this.denoiseAmount = clamp(amount, 0, 100);
			return this;
		}

		public Builder enhanceContrast(boolean enhanceContrast) {
			this.enhanceContrast = enhanceContrast;
			return this;
		}

		public Builder contrastAmount(double amount) {
			this.contrastAmount = clamp(amount, 0, 2);
			return this;
		}

		public PostProcessOptions build() {
			return new PostProcessOptions(this);
		}

		private static double clamp(double v, double lo, double hi) {
			if (Double.isNaN(v)) {
				return lo;
			}
			return Math.max(lo, Math.min(hi, v));
		}
	}
}
