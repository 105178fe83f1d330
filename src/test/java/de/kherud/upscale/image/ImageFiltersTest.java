package de.kherud.upscale.image;

import de.kherud.upscale.TestImages;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Isolated test for the image filters.
 */
public class ImageFiltersTest {

	@Test
	public void testGaussianKernelIsNormalizedAndSymmetric() {
		double[] kernel = ImageFilters.gaussianKernel(0.5);
		assertEquals(5, kernel.length);
		double sum = 0;
		for (int i = 0; i < kernel.length; i++) {
			sum += kernel[i];
			assertEquals(kernel[i], kernel[kernel.length - 1 - i], 1e-12);
		}
		assertEquals(1.0, sum, 1e-9);
		assertEquals(3, ImageFilters.gaussianKernel(0.1).length);
	}

	@Test
	public void testBlurSoftensEdge() {
		RasterImage edge = TestImages.solid(10, 4, 0, 0, 0, 255);
		for (int y = 0; y < 4; y++) {
			for (int x = 5; x < 10; x++) {
				edge.set(x, y, 0, 200);
			}
		}
		RasterImage blurred = ImageFilters.gaussianBlur(edge, 1.0);
		assertTrue(blurred.get(4, 2, 0) > 0);
		assertTrue(blurred.get(5, 2, 0) < 200);
		assertEquals(255, blurred.get(4, 2, 3));

		assertArrayEquals(edge.getPixels(), ImageFilters.gaussianBlur(edge, 0).getPixels());
	}

	@Test
	public void testUnsharpMaskIncreasesEdgeContrast() {
		RasterImage edge = TestImages.solid(10, 4, 80, 80, 80, 255);
		for (int y = 0; y < 4; y++) {
			for (int x = 5; x < 10; x++) {
				edge.set(x, y, 0, 160);
			}
		}
		RasterImage sharpened = ImageFilters.unsharpMask(edge, 1.0, 0.8, 0.3, 2);
		assertTrue("Dark side gets darker", sharpened.get(4, 2, 0) < 80);
		assertTrue("Bright side gets brighter", sharpened.get(5, 2, 0) > 160);
		assertEquals("Far from the edge nothing changes", 80, sharpened.get(0, 2, 0));
	}

	@Test
	public void testMedianRejectsBadWindow() {
		RasterImage image = TestImages.gradient(4, 4);
		for (int size : new int[]{1, 2, 4}) {
			try {
				ImageFilters.median(image, size);
				fail("Window " + size + " must be rejected");
			} catch (IllegalArgumentException expected) {
				// odd and >= 3 only
			}
		}
	}

	@Test
	public void testSaturateKeepsGray() {
		RasterImage gray = TestImages.solid(3, 3, 77, 77, 77, 128);
		assertArrayEquals(gray.getPixels(), ImageFilters.saturate(gray, 1.5).getPixels());
	}
}
