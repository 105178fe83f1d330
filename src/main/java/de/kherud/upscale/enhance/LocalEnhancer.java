package de.kherud.upscale.enhance;

import de.kherud.upscale.image.ImageFilters;
import de.kherud.upscale.image.RasterImage;
import org.jetbrains.annotations.Nullable;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Enhancement with local filters only: bicubic resampling followed by a light blur,
 * texture-aware sharpening and a very small saturation boost.
 *
 * The sharpening strength follows the textures reported for the image: gentler on skin,
 * stronger on hair, fur and hard surfaces.
 */
public final class LocalEnhancer implements EnhancementCapability {

	private static final System.Logger LOGGER = System.getLogger(LocalEnhancer.class.getName());

	static final double SMOOTHING_SIGMA = 0.3;
	static final double SATURATION_BOOST = 1.02;
	static final double SHARPEN_THRESHOLD = 2.0;

	/**
	 * Unsharp-mask parameters for a texture class.
	 */
	static final class SharpenProfile {
		final String name;
		final double sigma;
		final double flatGain;
		final double edgeGain;

		SharpenProfile(String name, double sigma, double flatGain, double edgeGain) {
			this.name = name;
			this.sigma = sigma;
			this.flatGain = flatGain;
			this.edgeGain = edgeGain;
		}
	}

	static final SharpenProfile DEFAULT_PROFILE = new SharpenProfile("default", 0.5, 0.8, 0.3);
	static final SharpenProfile SKIN_PROFILE = new SharpenProfile("skin", 0.4, 0.6, 0.2);
	static final SharpenProfile HAIR_PROFILE = new SharpenProfile("hair", 0.6, 1.0, 0.4);
	static final SharpenProfile FABRIC_PROFILE = new SharpenProfile("fabric", 0.5, 0.9, 0.35);
	static final SharpenProfile HARD_SURFACE_PROFILE = new SharpenProfile("hard-surface", 0.7, 1.2, 0.5);

	@Override
	public RasterImage enhance(RasterImage image, String prompt, double upscaleFactor, @Nullable TileContext context) {
		if (image == null) {
			throw new IllegalArgumentException("Image cannot be null");
		}
		double scale = upscaleFactor > 0 && Double.isFinite(upscaleFactor) ? upscaleFactor : 1.0;
		int targetWidth = EnhancementCapability.scaledSize(image.getWidth(), scale);
		int targetHeight = EnhancementCapability.scaledSize(image.getHeight(), scale);
		SharpenProfile profile = profileFor(context);

		RasterImage enhanced = image.resize(targetWidth, targetHeight);
		enhanced = ImageFilters.gaussianBlur(enhanced, SMOOTHING_SIGMA);
		enhanced = ImageFilters.unsharpMask(enhanced, profile.sigma, profile.flatGain, profile.edgeGain,
			SHARPEN_THRESHOLD);
		enhanced = ImageFilters.saturate(enhanced, SATURATION_BOOST);

		LOGGER.log(DEBUG, String.format("Tile enhanced locally: %dx%d -> %dx%d (%s profile%s)",
			image.getWidth(), image.getHeight(), targetWidth, targetHeight, profile.name,
			context != null ? ", " + context.getPosition() : ""));
		return enhanced;
	}

	static SharpenProfile profileFor(@Nullable TileContext context) {
		if (context == null) {
			return DEFAULT_PROFILE;
		}
		if (context.hasTexture("skin", "face")) {
			return SKIN_PROFILE;
		}
		if (context.hasTexture("hair", "fur")) {
			return HAIR_PROFILE;
		}
		if (context.hasTexture("fabric", "textile")) {
			return FABRIC_PROFILE;
		}
		if (context.hasTexture("metal", "glass")) {
			return HARD_SURFACE_PROFILE;
		}
		return DEFAULT_PROFILE;
	}
}
