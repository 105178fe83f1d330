package de.kherud.upscale.postprocess;

import de.kherud.upscale.image.ImageFilters;
import de.kherud.upscale.image.RasterImage;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Cosmetic passes over the merged canvas, applied in a fixed order:
 * <ol>
 *   <li>anti-block smoothing: Gaussian blur with sigma {@value #ANTI_BLOCK_SIGMA}</li>
 *   <li>median denoise, window 3 or 5 depending on the amount</li>
 *   <li>gentle unsharp mask with bounded gains so block edges do not grow halos</li>
 *   <li>mild saturation boost when the contrast amount is above neutral</li>
 * </ol>
 * No stage looks at tile boundaries.
 */
public final class PostProcessor {

	static final double ANTI_BLOCK_SIGMA = 0.5;
	static final double SHARPEN_THRESHOLD = 2.0;

	private static final System.Logger LOGGER = System.getLogger(PostProcessor.class.getName());

	private PostProcessor() {
		throw new AssertionError("Utility class should not be instantiated");
	}

	public static RasterImage postProcess(RasterImage image, PostProcessOptions options) {
		PostProcessOptions opts = options != null ? options : PostProcessOptions.defaults();
		LOGGER.log(DEBUG, "Post-processing " + image + " with " + opts);
		RasterImage result = image;

		if (opts.isAntiBlock()) {
			result = ImageFilters.gaussianBlur(result, ANTI_BLOCK_SIGMA);
		}

		if (opts.isDenoise() && opts.getDenoiseAmount() > 0) {
			result = ImageFilters.median(result, medianWindow(opts.getDenoiseAmount()));
		}

		if (opts.isSharpen() && opts.getSharpenAmount() > 0) {
			double amount = opts.getSharpenAmount();
			double sigma = clamp(0.3 + amount * 0.3, 0.3, 1.0);
			double flatGain = clamp(amount * 0.8, 0, 1.5);
			double edgeGain = clamp(amount * 0.3, 0, 0.5);
			result = ImageFilters.unsharpMask(result, sigma, flatGain, edgeGain, SHARPEN_THRESHOLD);
		}

		if (opts.isEnhanceContrast() && opts.getContrastAmount() > 1) {
			result = ImageFilters.saturate(result, saturationFactor(opts.getContrastAmount()));
		}

		return result;
	}

	/**
	 * Odd median window for a denoise amount in [0, 100]: 3 up to 25, 5 above.
	 */
	static int medianWindow(double denoiseAmount) {
		int size = (int) Math.max(3, Math.min(5, Math.ceil(denoiseAmount / 25) + 2));
		return size % 2 == 0 ? size + 1 : size;
	}

	static double saturationFactor(double contrastAmount) {
		return Math.min(1.1, 1 + (contrastAmount - 1) * 0.05);
	}

	private static double clamp(double v, double lo, double hi) {
		return Math.max(lo, Math.min(hi, v));
	}
}
