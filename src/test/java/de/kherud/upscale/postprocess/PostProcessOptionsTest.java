package de.kherud.upscale.postprocess;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Test cases for PostProcessOptions.
 */
public class PostProcessOptionsTest {

	@Test
	public void testDefaults() {
		PostProcessOptions options = PostProcessOptions.defaults();
		assertTrue(options.isAntiBlock());
		assertFalse(options.isSharpen());
		assertFalse(options.isDenoise());
		assertFalse(options.isEnhanceContrast());
		assertEquals(1.0, options.getContrastAmount(), 0.0);
	}

	@Test
	public void testAmountsAreClamped() {
		PostProcessOptions options = PostProcessOptions.builder()
			.sharpenAmount(5)
			.denoiseAmount(-10)
			.contrastAmount(9)
			.build();
		assertEquals(1.0, options.getSharpenAmount(), 0.0);
		assertEquals(0.0, options.getDenoiseAmount(), 0.0);
		assertEquals(2.0, options.getContrastAmount(), 0.0);

		PostProcessOptions nan = PostProcessOptions.builder().sharpenAmount(Double.NaN).denoiseAmount(500).build();
		assertEquals(0.0, nan.getSharpenAmount(), 0.0);
		assertEquals(100.0, nan.getDenoiseAmount(), 0.0);
	}

	@Test
	public void testQualityKnobMapping() {
		PostProcessOptions neutral = PostProcessOptions.fromQualityKnobs(50, 0, 50);
		assertTrue(neutral.isAntiBlock());
		assertTrue(neutral.isSharpen());
		assertEquals(0.5, neutral.getSharpenAmount(), 1e-9);
		assertFalse(neutral.isDenoise());
		assertFalse(neutral.isEnhanceContrast());
		assertEquals(1.0, neutral.getContrastAmount(), 1e-9);

		PostProcessOptions tuned = PostProcessOptions.fromQualityKnobs(5, 30, 80);
		assertFalse(tuned.isSharpen());
		assertTrue(tuned.isDenoise());
		assertEquals(30.0, tuned.getDenoiseAmount(), 1e-9);
		assertTrue(tuned.isEnhanceContrast());
		assertEquals(1.6, tuned.getContrastAmount(), 1e-9);

		assertTrue(PostProcessOptions.fromQualityKnobs(50, 0, 40).isEnhanceContrast());
		assertFalse(PostProcessOptions.fromQualityKnobs(50, 20, 55).isDenoise());
		assertFalse(PostProcessOptions.fromQualityKnobs(50, 20, 55).isEnhanceContrast());
	}
}
