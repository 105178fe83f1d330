package de.kherud.upscale.tiling;

import de.kherud.upscale.TestImages;
import de.kherud.upscale.UpscaleException;
import de.kherud.upscale.analysis.ImageAnalysis;
import de.kherud.upscale.enhance.EnhancementCapability;
import de.kherud.upscale.enhance.TileContext;
import de.kherud.upscale.image.RasterImage;
import org.junit.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Test suite for TileScheduler.
 * Validates ordering, the concurrency bound, failure propagation and progress reporting.
 */
public class TileSchedulerTest {

	private static List<Tile> tiles(int width, int height, int tileSize, int overlap) {
		return TileDecomposer.decompose(TestImages.gradient(width, height), tileSize, overlap).getTiles();
	}

	@Test
	public void testResultOrderMatchesInputUnderRandomDelays() {
		System.out.println("\n⚙️ Testing result order with out-of-order completion");

		List<Tile> tiles = tiles(200, 200, 48, 8);
		EnhancementCapability jittery = (image, prompt, factor, context) -> {
			Thread.sleep(ThreadLocalRandom.current().nextInt(15));
			return TestImages.nearest(image, 2);
		};

		List<EnhancedTile> results = new TileScheduler(jittery, 4, null).enhanceAll(tiles, "p", 2.0, null, 0, 0);

		assertEquals(tiles.size(), results.size());
		for (int i = 0; i < tiles.size(); i++) {
			Tile tile = tiles.get(i);
			EnhancedTile enhanced = results.get(i);
			assertEquals(tile.getX(), enhanced.getX());
			assertEquals(tile.getY(), enhanced.getY());
			assertArrayEquals("Result " + i + " belongs to tile " + i,
				TestImages.nearest(tile.getPixels(), 2).getPixels(), enhanced.getEnhanced().getPixels());
		}
		System.out.println("✅ " + results.size() + " results in input order");
	}

	@Test
	public void testConcurrencyLimitIsRespected() {
		System.out.println("\n⚙️ Testing concurrency bound");

		AtomicInteger active = new AtomicInteger();
		AtomicInteger peak = new AtomicInteger();
		EnhancementCapability slow = (image, prompt, factor, context) -> {
			int now = active.incrementAndGet();
			peak.accumulateAndGet(now, Math::max);
			try {
				Thread.sleep(20);
				return image.copy();
			} finally {
				active.decrementAndGet();
			}
		};

		List<Tile> tiles = tiles(160, 160, 32, 0);
		new TileScheduler(slow, 3, null).enhanceAll(tiles, "p", 1.0, null, 0, 0);

		assertTrue("At most 3 calls in flight, saw " + peak.get(), peak.get() <= 3);
		assertTrue("At least one call ran", peak.get() >= 1);
		System.out.println("✅ Peak concurrency " + peak.get() + " for " + tiles.size() + " tiles");
	}

	@Test
	public void testFailureFailsWholeBatch() {
		System.out.println("\n⚙️ Testing failure propagation");

		AtomicInteger calls = new AtomicInteger();
		EnhancementCapability failing = (image, prompt, factor, context) -> {
			if (calls.incrementAndGet() == 3) {
				throw new IOException("model unavailable");
			}
			return image.copy();
		};

		try {
			new TileScheduler(failing, 1, null).enhanceAll(tiles(128, 128, 32, 0), "p", 1.0, null, 0, 0);
			fail("A failing tile must fail the batch");
		} catch (UpscaleException e) {
			assertEquals(UpscaleException.ErrorKind.ENHANCEMENT_FAILED, e.getKind());
			assertTrue(e.getMessage().contains("model unavailable"));
		}
		assertEquals("No tile is claimed after the failure with one worker", 3, calls.get());
		System.out.println("✅ Failure surfaced as ENHANCEMENT_FAILED");
	}

	@Test
	public void testTimeoutsAreReportedAsTimedOut() {
		EnhancementCapability httpTimeout = (image, prompt, factor, context) -> {
			throw new HttpTimeoutException("request timed out");
		};
		EnhancementCapability wrappedTimeout = (image, prompt, factor, context) -> {
			throw new IOException("upstream", new TimeoutException("deadline"));
		};

		for (EnhancementCapability capability : Arrays.asList(httpTimeout, wrappedTimeout)) {
			try {
				new TileScheduler(capability, 2, null).enhanceAll(tiles(64, 64, 32, 0), "p", 1.0, null, 0, 0);
				fail("Timeout must fail the batch");
			} catch (UpscaleException e) {
				assertEquals(UpscaleException.ErrorKind.TIMED_OUT, e.getKind());
			}
		}
	}

	@Test
	public void testUpscaleExceptionPassesThrough() {
		EnhancementCapability rejecting = (image, prompt, factor, context) -> {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_IMAGE, "bad tile");
		};
		try {
			new TileScheduler(rejecting).enhanceAll(tiles(32, 32, 32, 0), "p", 1.0, null, 0, 0);
			fail("Should propagate");
		} catch (UpscaleException e) {
			assertEquals(UpscaleException.ErrorKind.INVALID_IMAGE, e.getKind());
		}
	}

	@Test
	public void testContextCarriesPositionAndAnalysis() {
		System.out.println("\n⚙️ Testing per-tile context");

		Set<String> positions = ConcurrentHashMap.newKeySet();
		List<TileContext> contexts = Collections.synchronizedList(new ArrayList<>());
		EnhancementCapability recording = (image, prompt, factor, context) -> {
			contexts.add(context);
			positions.add(context.getPosition());
			return image.copy();
		};
		ImageAnalysis analysis = new ImageAnalysis("a cat on a sofa", Arrays.asList("fur", "fabric"),
			Collections.singletonList("animal"));

		new TileScheduler(recording, 2, null).enhanceAll(tiles(512, 512, 256, 64), "p", 1.0, analysis, 512, 512);

		assertEquals(9, contexts.size());
		for (TileContext context : contexts) {
			assertEquals("a cat on a sofa", context.getImageDescription());
			assertEquals(Arrays.asList("fur", "fabric"), context.getTextures());
			assertEquals(Collections.singletonList("animal"), context.getSubjects());
		}
		assertTrue(positions.contains("center"));
		assertTrue(positions.contains("top-left corner"));
		assertTrue(positions.contains("bottom-right corner"));
		System.out.println("✅ Contexts: " + positions);
	}

	@Test
	public void testNoAnalysisMeansNoContext() {
		List<TileContext> contexts = Collections.synchronizedList(new ArrayList<>());
		EnhancementCapability recording = (image, prompt, factor, context) -> {
			contexts.add(context);
			return image.copy();
		};
		new TileScheduler(recording).enhanceAll(tiles(64, 64, 32, 0), "p", 1.0, null, 64, 64);

		assertEquals(4, contexts.size());
		for (TileContext context : contexts) {
			assertNull(context);
		}
	}

	@Test
	public void testProgressListener() {
		AtomicInteger notifications = new AtomicInteger();
		AtomicInteger highest = new AtomicInteger();
		TileScheduler.ProgressListener listener = (completed, total) -> {
			notifications.incrementAndGet();
			highest.accumulateAndGet(completed, Math::max);
			assertEquals(16, total);
		};

		new TileScheduler((image, prompt, factor, context) -> image.copy(), 4, listener)
			.enhanceAll(tiles(128, 128, 32, 0), "p", 1.0, null, 0, 0);

		assertEquals(16, notifications.get());
		assertEquals(16, highest.get());
	}

	@Test
	public void testRefineKeepsIdentityAndScale() {
		List<Double> factors = Collections.synchronizedList(new ArrayList<>());
		EnhancementCapability recording = (image, prompt, factor, context) -> {
			factors.add(factor);
			return image.copy();
		};
		TileScheduler scheduler = new TileScheduler(recording, 2, null);
		List<EnhancedTile> first = scheduler.enhanceAll(tiles(64, 64, 32, 0), "p", 1.0, null, 0, 0);
		factors.clear();

		List<EnhancedTile> refined = scheduler.refineAll(first, "again");

		assertEquals(first.size(), refined.size());
		for (int i = 0; i < first.size(); i++) {
			assertEquals(first.get(i).getX(), refined.get(i).getX());
			assertEquals(first.get(i).getY(), refined.get(i).getY());
		}
		for (double factor : factors) {
			assertEquals(1.0, factor, 0.0);
		}
	}

	@Test
	public void testEmptyInputAndInvalidArguments() {
		TileScheduler scheduler = new TileScheduler((image, prompt, factor, context) -> image);
		assertTrue(scheduler.enhanceAll(Collections.emptyList(), "p", 2.0, null, 0, 0).isEmpty());
		assertEquals(TileScheduler.DEFAULT_CONCURRENCY, scheduler.getConcurrency());

		try {
			new TileScheduler((image, prompt, factor, context) -> image, 0, null);
			fail("Should reject zero concurrency");
		} catch (UpscaleException e) {
			assertEquals(UpscaleException.ErrorKind.INVALID_PARAMETER, e.getKind());
		}
		try {
			new TileScheduler(null);
			fail("Should reject missing capability");
		} catch (IllegalArgumentException expected) {
			// required
		}
	}

	@Test
	public void testSingleTileBatch() {
		RasterImage before = TestImages.gradient(8, 8);
		List<Tile> single = Collections.singletonList(new Tile(0, 0, 8, 8, before));
		List<EnhancedTile> result = new TileScheduler((image, prompt, factor, context) -> image.copy())
			.enhanceAll(single, "p", 1.0, null, 0, 0);
		assertArrayEquals(before.getPixels(), result.get(0).getEnhanced().getPixels());
	}
}
