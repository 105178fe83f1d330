package de.kherud.upscale.image;

import java.util.Arrays;

/**
 * Whole-canvas pixel filters shared by the local enhancer and the post-processing stage.
 *
 * Every filter returns a new image, treats pixels outside the canvas as a copy of the nearest
 * edge pixel and leaves the alpha channel untouched.
 */
public final class ImageFilters {

	private static final int COLOR_CHANNELS = 3;

	private ImageFilters() {
		throw new AssertionError("Utility class should not be instantiated");
	}

	/**
	 * Separable Gaussian blur.
	 *
	 * @param sigma standard deviation in pixels; values {@code <= 0} return an unmodified copy
	 */
	public static RasterImage gaussianBlur(RasterImage image, double sigma) {
		if (sigma <= 0) {
			return image.copy();
		}
		double[] kernel = gaussianKernel(sigma);
		int radius = kernel.length / 2;
		int w = image.getWidth();
		int h = image.getHeight();
		byte[] src = image.getPixels();

		double[] horizontal = new double[w * h * COLOR_CHANNELS];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				for (int c = 0; c < COLOR_CHANNELS; c++) {
					double sum = 0;
					for (int k = -radius; k <= radius; k++) {
						int sx = clamp(x + k, 0, w - 1);
						sum += kernel[k + radius] * (src[(y * w + sx) * RasterImage.CHANNELS + c] & 0xFF);
					}
					horizontal[(y * w + x) * COLOR_CHANNELS + c] = sum;
				}
			}
		}

		byte[] out = src.clone();
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				for (int c = 0; c < COLOR_CHANNELS; c++) {
					double sum = 0;
					for (int k = -radius; k <= radius; k++) {
						int sy = clamp(y + k, 0, h - 1);
						sum += kernel[k + radius] * horizontal[(sy * w + x) * COLOR_CHANNELS + c];
					}
					out[(y * w + x) * RasterImage.CHANNELS + c] = toByte(sum);
				}
			}
		}
		return RasterImage.wrap(w, h, out);
	}

	/**
	 * Median filter over a square window.
	 *
	 * @param size odd window size, at least 3
	 */
	public static RasterImage median(RasterImage image, int size) {
		if (size < 3 || size % 2 == 0) {
			throw new IllegalArgumentException("Median window must be odd and at least 3, got " + size);
		}
		int radius = size / 2;
		int w = image.getWidth();
		int h = image.getHeight();
		byte[] src = image.getPixels();
		byte[] out = src.clone();
		int[] window = new int[size * size];

		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				for (int c = 0; c < COLOR_CHANNELS; c++) {
					int n = 0;
					for (int dy = -radius; dy <= radius; dy++) {
						int sy = clamp(y + dy, 0, h - 1);
						for (int dx = -radius; dx <= radius; dx++) {
							int sx = clamp(x + dx, 0, w - 1);
							window[n++] = src[(sy * w + sx) * RasterImage.CHANNELS + c] & 0xFF;
						}
					}
					Arrays.sort(window, 0, n);
					out[(y * w + x) * RasterImage.CHANNELS + c] = (byte) window[n / 2];
				}
			}
		}
		return RasterImage.wrap(w, h, out);
	}

	/**
	 * Unsharp mask with separate gains for flat and jagged areas.
	 *
	 * The detail signal {@code d = pixel - blur(pixel)} is amplified by {@code flatGain} while
	 * {@code |d| <= threshold} and by {@code edgeGain} beyond it, which keeps halos on strong
	 * edges small.
	 *
	 * @param sigma blur radius of the mask
	 * @param flatGain gain applied to small detail differences
	 * @param edgeGain gain applied to the part of a difference above {@code threshold}
	 * @param threshold flat/jagged boundary in 8-bit levels
	 */
	public static RasterImage unsharpMask(RasterImage image, double sigma, double flatGain, double edgeGain,
										  double threshold) {
		RasterImage blurred = gaussianBlur(image, sigma);
		byte[] src = image.getPixels();
		byte[] soft = blurred.getPixels();
		byte[] out = src.clone();

		for (int i = 0; i < src.length; i += RasterImage.CHANNELS) {
			for (int c = 0; c < COLOR_CHANNELS; c++) {
				int value = src[i + c] & 0xFF;
				double detail = value - (soft[i + c] & 0xFF);
				double magnitude = Math.abs(detail);
				double boost = magnitude <= threshold
					? flatGain * magnitude
					: flatGain * threshold + edgeGain * (magnitude - threshold);
				out[i + c] = toByte(value + Math.signum(detail) * boost);
			}
		}
		return RasterImage.wrap(image.getWidth(), image.getHeight(), out);
	}

	/**
	 * Scale chroma around Rec.601 luma; {@code factor > 1} saturates, {@code factor < 1} desaturates.
	 */
	public static RasterImage saturate(RasterImage image, double factor) {
		byte[] src = image.getPixels();
		byte[] out = src.clone();
		for (int i = 0; i < src.length; i += RasterImage.CHANNELS) {
			int r = src[i] & 0xFF;
			int g = src[i + 1] & 0xFF;
			int b = src[i + 2] & 0xFF;
			double luma = 0.299 * r + 0.587 * g + 0.114 * b;
			out[i] = toByte(luma + (r - luma) * factor);
			out[i + 1] = toByte(luma + (g - luma) * factor);
			out[i + 2] = toByte(luma + (b - luma) * factor);
		}
		return RasterImage.wrap(image.getWidth(), image.getHeight(), out);
	}

	static double[] gaussianKernel(double sigma) {
		int radius = Math.max(1, (int) Math.ceil(3 * sigma));
		double[] kernel = new double[2 * radius + 1];
		double sum = 0;
		for (int i = -radius; i <= radius; i++) {
			double v = Math.exp(-(i * i) / (2 * sigma * sigma));
			kernel[i + radius] = v;
			sum += v;
		}
		for (int i = 0; i < kernel.length; i++) {
			kernel[i] /= sum;
		}
		return kernel;
	}

	private static int clamp(int v, int lo, int hi) {
		return v < lo ? lo : (v > hi ? hi : v);
	}

	private static byte toByte(double v) {
		long rounded = Math.round(v);
		return (byte) (rounded < 0 ? 0 : (rounded > 255 ? 255 : rounded));
	}
}
