package de.kherud.upscale.enhance;

import de.kherud.upscale.image.RasterImage;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Pluggable transform that enhances, and optionally upscales, a pixel buffer.
 *
 * Implementations must return an image of {@code round(width * upscaleFactor)} by
 * {@code round(height * upscaleFactor)} pixels, or fail. Timeouts are reported as
 * {@link java.net.http.HttpTimeoutException} or {@link java.util.concurrent.TimeoutException}
 * (possibly as the cause of another exception). Any retry policy lives inside the implementation.
 * Implementations are called from several worker threads at once and must be thread-safe.
 */
@FunctionalInterface
public interface EnhancementCapability {

	/**
	 * @param image tile or whole image to enhance
	 * @param prompt free-text guidance for the enhancement
	 * @param upscaleFactor output/input size ratio, 1 for refinement passes
	 * @param context tile position and image analysis, or null when unavailable
	 * @return enhanced image
	 */
	RasterImage enhance(RasterImage image, String prompt, double upscaleFactor, @Nullable TileContext context)
		throws IOException, InterruptedException;

	/**
	 * Whether this capability calls a remote model rather than local filters.
	 */
	default boolean isRemote() {
		return false;
	}

	/**
	 * Expected output size along one axis for a given input size and factor.
	 */
	static int scaledSize(int size, double upscaleFactor) {
		return Math.max(1, (int) Math.round(size * upscaleFactor));
	}
}
