package de.kherud.upscale.tiling;

import de.kherud.upscale.UpscaleException;
import de.kherud.upscale.analysis.ImageAnalysis;
import de.kherud.upscale.enhance.EnhancementCapability;
import de.kherud.upscale.enhance.TileContext;
import de.kherud.upscale.image.RasterImage;
import org.jetbrains.annotations.Nullable;

import java.net.http.HttpTimeoutException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

/**
 * Sends tiles through an {@link EnhancementCapability} with a bounded number of concurrent calls.
 *
 * A fixed pool of workers claims tile indices from a shared atomic counter; each worker writes
 * only to the result slot of the index it claimed, so {@code results[i]} always belongs to
 * {@code tiles[i]} whatever the completion order. The pool size is the only backpressure towards
 * the capability.
 *
 * The first failing tile fails the whole batch: no further tiles are claimed, in-flight calls are
 * interrupted and no partial result is returned.
 */
public class TileScheduler {

	public static final int DEFAULT_CONCURRENCY = 5;

	private static final System.Logger LOGGER = System.getLogger(TileScheduler.class.getName());
	private static final int PROGRESS_LOG_INTERVAL = 5;
	private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

	/**
	 * Receives the completion count after every finished tile. Called from worker threads.
	 */
	@FunctionalInterface
	public interface ProgressListener {
		void onTileCompleted(int completed, int total);
	}

	@FunctionalInterface
	private interface TileTask<T extends Tile> {
		RasterImage run(T tile) throws Exception;
	}

	private final EnhancementCapability capability;
	private final int concurrency;
	private final ProgressListener progressListener;

	public TileScheduler(EnhancementCapability capability) {
		this(capability, DEFAULT_CONCURRENCY, null);
	}

	/**
	 * @param capability enhancement applied to every tile
	 * @param concurrency maximum number of simultaneous capability calls
	 * @param progressListener optional progress callback
	 * @throws IllegalArgumentException if the capability is null
	 * @throws UpscaleException with {@code INVALID_PARAMETER} if {@code concurrency < 1}
	 */
	public TileScheduler(EnhancementCapability capability, int concurrency, @Nullable ProgressListener progressListener) {
		if (capability == null) {
			throw new IllegalArgumentException("Enhancement capability cannot be null");
		}
		if (concurrency < 1) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_PARAMETER,
				"Concurrency limit must be at least 1, got " + concurrency);
		}
		this.capability = capability;
		this.concurrency = concurrency;
		this.progressListener = progressListener;
	}

	/**
	 * Enhance every tile.
	 *
	 * @param tiles tiles to enhance
	 * @param prompt enhancement guidance
	 * @param upscaleFactor output/input size ratio
	 * @param analysis image analysis used to build per-tile context, or null for no context
	 * @param imageWidth source width, used for the tile position label
	 * @param imageHeight source height, used for the tile position label
	 * @return enhanced tiles, {@code result.get(i)} derived from {@code tiles.get(i)}
	 * @throws UpscaleException with {@code ENHANCEMENT_FAILED} or {@code TIMED_OUT} if any tile fails
	 */
	public List<EnhancedTile> enhanceAll(List<Tile> tiles, String prompt, double upscaleFactor,
										 @Nullable ImageAnalysis analysis, int imageWidth, int imageHeight) {
		boolean withContext = analysis != null && imageWidth > 0 && imageHeight > 0;
		if (analysis != null) {
			LOGGER.log(DEBUG, "Image analysis: " + analysis.getDescription()
				+ ", textures: " + String.join(", ", analysis.getTextures())
				+ ", subjects: " + String.join(", ", analysis.getSubjects()));
		}

		return runBounded(tiles, "Enhancing", tile -> {
			TileContext context = withContext
				? analysis.toContext(TilePosition.describe(tile, imageWidth, imageHeight))
				: null;
			return capability.enhance(tile.getPixels(), prompt, upscaleFactor, context);
		});
	}

	/**
	 * Re-submit each tile's enhanced buffer at upscale factor 1, keeping tile identity.
	 */
	public List<EnhancedTile> refineAll(List<EnhancedTile> tiles, String prompt) {
		return runBounded(tiles, "Refining", tile -> capability.enhance(tile.getEnhanced(), prompt, 1.0, null));
	}

	public int getConcurrency() {
		return concurrency;
	}

	private <T extends Tile> List<EnhancedTile> runBounded(List<T> tiles, String label, TileTask<T> task) {
		int total = tiles.size();
		if (total == 0) {
			return Collections.emptyList();
		}

		EnhancedTile[] results = new EnhancedTile[total];
		AtomicInteger next = new AtomicInteger();
		AtomicInteger completed = new AtomicInteger();
		AtomicBoolean failed = new AtomicBoolean();
		int workerCount = Math.min(concurrency, total);

		LOGGER.log(INFO, String.format("%s %d tiles with %d workers", label, total, workerCount));

		ExecutorService executor = Executors.newFixedThreadPool(workerCount, workerThreadFactory());
		CompletionService<Void> workers = new ExecutorCompletionService<>(executor);
		try {
			for (int i = 0; i < workerCount; i++) {
				workers.submit(() -> {
					for (;;) {
						if (failed.get()) {
							return null;
						}
						int current = next.getAndIncrement();
						if (current >= total) {
							return null;
						}
						T tile = tiles.get(current);
						try {
							results[current] = new EnhancedTile(tile, task.run(tile));
						} catch (Exception e) {
							failed.set(true);
							throw translate(e, current, tile);
						}
						reportProgress(label, completed.incrementAndGet(), total);
					}
				});
			}
			for (int i = 0; i < workerCount; i++) {
				workers.take().get();
			}
		} catch (ExecutionException e) {
			failed.set(true);
			Throwable cause = e.getCause();
			LOGGER.log(ERROR, label + " tiles failed: " + cause.getMessage(), cause);
			if (cause instanceof UpscaleException) {
				throw (UpscaleException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new UpscaleException(UpscaleException.ErrorKind.ENHANCEMENT_FAILED,
				label + " tiles failed: " + cause.getMessage(), cause);
		} catch (InterruptedException e) {
			failed.set(true);
			Thread.currentThread().interrupt();
			throw new UpscaleException(UpscaleException.ErrorKind.ENHANCEMENT_FAILED,
				label + " tiles was interrupted", e);
		} finally {
			executor.shutdownNow();
		}

		return Arrays.asList(results);
	}

	private void reportProgress(String label, int done, int total) {
		if (done % PROGRESS_LOG_INTERVAL == 0 || done == total) {
			LOGGER.log(INFO, String.format("Progress: %d/%d tiles (%s)", done, total, label.toLowerCase()));
		}
		if (progressListener != null) {
			progressListener.onTileCompleted(done, total);
		}
	}

	static UpscaleException translate(Exception e, int index, Tile tile) {
		if (e instanceof UpscaleException) {
			return (UpscaleException) e;
		}
		if (e instanceof InterruptedException) {
			Thread.currentThread().interrupt();
		}
		String where = "tile " + index + " " + tile;
		if (isTimeout(e)) {
			return new UpscaleException(UpscaleException.ErrorKind.TIMED_OUT,
				"Enhancement timed out for " + where + ": " + e.getMessage(), e);
		}
		return new UpscaleException(UpscaleException.ErrorKind.ENHANCEMENT_FAILED,
			"Enhancement failed for " + where + ": " + e.getMessage(), e);
	}

	private static boolean isTimeout(Throwable e) {
		for (Throwable t = e; t != null; t = t.getCause()) {
			if (t instanceof HttpTimeoutException || t instanceof TimeoutException) {
				return true;
			}
			if (t.getCause() == t) {
				break;
			}
		}
		return false;
	}

	private static ThreadFactory workerThreadFactory() {
		int pool = POOL_COUNTER.incrementAndGet();
		AtomicInteger worker = new AtomicInteger();
		return r -> {
			Thread t = new Thread(r);
			t.setName("tile-worker-" + pool + "-" + worker.incrementAndGet());
			t.setDaemon(true);
			return t;
		};
	}
}
