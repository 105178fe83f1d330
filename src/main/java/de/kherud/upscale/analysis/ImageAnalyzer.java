package de.kherud.upscale.analysis;

import de.kherud.upscale.image.RasterImage;

/**
 * Optional capability that describes an image's content, textures and subjects.
 *
 * Implementations should not fail: when analysis is impossible they return
 * {@link ImageAnalysis#defaults()}. Callers still treat any exception as "no analysis".
 */
@FunctionalInterface
public interface ImageAnalyzer {

	ImageAnalysis analyze(RasterImage image);

	/**
	 * Analyzer that always answers with the default context.
	 */
	static ImageAnalyzer defaults() {
		return image -> ImageAnalysis.defaults();
	}
}
