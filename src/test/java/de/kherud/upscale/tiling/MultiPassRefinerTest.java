package de.kherud.upscale.tiling;

import de.kherud.upscale.TestImages;
import de.kherud.upscale.UpscaleException;
import de.kherud.upscale.enhance.EnhancementCapability;
import de.kherud.upscale.image.RasterImage;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Test for MultiPassRefiner pass counting and prompts.
 */
public class MultiPassRefinerTest {

	private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());
	private final AtomicInteger calls = new AtomicInteger();

	private final EnhancementCapability brighten = (image, prompt, factor, context) -> {
		calls.incrementAndGet();
		prompts.add(prompt);
		assertEquals("Refinement runs at scale 1", 1.0, factor, 0.0);
		RasterImage out = image.copy();
		for (int y = 0; y < out.getHeight(); y++) {
			for (int x = 0; x < out.getWidth(); x++) {
				out.set(x, y, 0, Math.min(255, out.get(x, y, 0) + 1));
			}
		}
		return out;
	};

	private List<EnhancedTile> firstPass() {
		List<EnhancedTile> tiles = new ArrayList<>();
		for (Tile tile : TileDecomposer.decompose(TestImages.solid(64, 64, 10, 10, 10, 255), 32, 0).getTiles()) {
			tiles.add(new EnhancedTile(tile, tile.getPixels().copy()));
		}
		return tiles;
	}

	@Test
	public void testSinglePassIsNoOp() {
		List<EnhancedTile> tiles = firstPass();
		List<EnhancedTile> refined = new MultiPassRefiner(new TileScheduler(brighten)).refine(tiles, 1, "detail");

		assertSame(tiles, refined);
		assertEquals(0, calls.get());
	}

	@Test
	public void testEachExtraPassResubmitsEveryTile() {
		System.out.println("\n🔁 Testing three-pass refinement");

		List<EnhancedTile> tiles = firstPass();
		List<EnhancedTile> refined = new MultiPassRefiner(new TileScheduler(brighten, 2, null))
			.refine(tiles, 3, "detail");

		assertEquals(tiles.size() * 2, calls.get());
		assertEquals(tiles.size(), refined.size());
		for (EnhancedTile tile : refined) {
			assertEquals("Two refinement passes applied", 12, tile.getEnhanced().get(0, 0, 0));
			assertEquals(32, tile.getEnhanced().getWidth());
		}
		long pass2 = prompts.stream().filter(p -> p.contains("Pass 2")).count();
		long pass3 = prompts.stream().filter(p -> p.contains("Pass 3")).count();
		assertEquals(tiles.size(), pass2);
		assertEquals(tiles.size(), pass3);
		System.out.println("✅ " + calls.get() + " refinement calls");
	}

	@Test
	public void testPassPrompt() {
		assertEquals("detail. Pass 2: Refine details further, enhance micro-textures, increase clarity.",
			MultiPassRefiner.passPrompt("detail", 2));
	}

	@Test
	public void testInvalidPassCount() {
		try {
			new MultiPassRefiner(new TileScheduler(brighten)).refine(firstPass(), 0, "detail");
			fail("Pass count 0 must be rejected");
		} catch (UpscaleException e) {
			assertEquals(UpscaleException.ErrorKind.INVALID_PARAMETER, e.getKind());
			assertTrue(e.getMessage().contains("Pass count"));
		}
	}
}
