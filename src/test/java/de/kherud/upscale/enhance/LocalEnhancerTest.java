package de.kherud.upscale.enhance;

import de.kherud.upscale.TestImages;
import de.kherud.upscale.image.RasterImage;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

/**
 * Test for LocalEnhancer resampling.
 */
public class LocalEnhancerTest {

	private final LocalEnhancer enhancer = new LocalEnhancer();

	private static TileContext withTextures(String... textures) {
		return new TileContext("center", "test", Arrays.asList(textures), Collections.singletonList("unknown"));
	}

	@Test
	public void testOutputSizeFollowsFactor() {
		System.out.println("\n🔍 Testing local enhancement output size");

		RasterImage tile = TestImages.gradient(33, 20);
		assertSize(66, 40, enhancer.enhance(tile, "p", 2.0, null));
		assertSize(33, 20, enhancer.enhance(tile, "p", 1.0, null));
		assertSize(50, 30, enhancer.enhance(tile, "p", 1.5, null));
		assertSize(1, 1, enhancer.enhance(TestImages.gradient(1, 1), "p", 0.1, null));

		System.out.println("✅ Sizes scale with the factor");
	}

	@Test
	public void testNonFiniteFactorKeepsSize() {
		RasterImage tile = TestImages.gradient(12, 9);
		assertSize(12, 9, enhancer.enhance(tile, "p", Double.NaN, null));
		assertSize(12, 9, enhancer.enhance(tile, "p", -2.0, null));
	}

	@Test
	public void testFlatImageStaysFlatAndOpaque() {
		RasterImage gray = TestImages.solid(16, 16, 120, 120, 120, 255);
		RasterImage out = enhancer.enhance(gray, "p", 2.0, withTextures("metal"));

		for (int y = 0; y < out.getHeight(); y++) {
			for (int x = 0; x < out.getWidth(); x++) {
				// resampling may round by a level, sharpening may amplify it slightly
				assertEquals(120, out.get(x, y, 0), 3);
				assertEquals(120, out.get(x, y, 1), 3);
				assertTrue("Alpha stays opaque", out.get(x, y, 3) >= 250);
			}
		}
	}

	@Test
	public void testInputIsNotModified() {
		RasterImage tile = TestImages.gradient(16, 16);
		byte[] before = tile.getPixels().clone();
		enhancer.enhance(tile, "p", 2.0, withTextures("hair"));
		assertTrue("Input buffer must not be touched", Arrays.equals(before, tile.getPixels()));
	}

	@Test
	public void testProfileSelection() {
		assertSame(LocalEnhancer.DEFAULT_PROFILE, LocalEnhancer.profileFor(null));
		assertSame(LocalEnhancer.DEFAULT_PROFILE, LocalEnhancer.profileFor(withTextures("general")));
		assertSame(LocalEnhancer.SKIN_PROFILE, LocalEnhancer.profileFor(withTextures("Skin", "hair")));
		assertSame(LocalEnhancer.SKIN_PROFILE, LocalEnhancer.profileFor(withTextures("face")));
		assertSame(LocalEnhancer.HAIR_PROFILE, LocalEnhancer.profileFor(withTextures("dog fur")));
		assertSame(LocalEnhancer.FABRIC_PROFILE, LocalEnhancer.profileFor(withTextures("textile")));
		assertSame(LocalEnhancer.HARD_SURFACE_PROFILE, LocalEnhancer.profileFor(withTextures("brushed metal")));
		assertSame(LocalEnhancer.HARD_SURFACE_PROFILE, LocalEnhancer.profileFor(withTextures("glass")));
	}

	@Test
	public void testNullImageRejected() {
		try {
			enhancer.enhance(null, "p", 2.0, null);
			fail("Null image must be rejected");
		} catch (IllegalArgumentException expected) {
			// required
		}
	}

	private static void assertSize(int width, int height, RasterImage image) {
		assertEquals("width", width, image.getWidth());
		assertEquals("height", height, image.getHeight());
	}
}
