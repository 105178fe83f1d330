package de.kherud.upscale;

import de.kherud.upscale.analysis.ImageAnalysis;
import de.kherud.upscale.analysis.ImageAnalyzer;
import de.kherud.upscale.enhance.EnhancementCapability;
import de.kherud.upscale.enhance.TileContext;
import de.kherud.upscale.image.RasterImage;
import de.kherud.upscale.postprocess.PostProcessOptions;
import de.kherud.upscale.postprocess.PostProcessor;
import de.kherud.upscale.tiling.Decomposition;
import de.kherud.upscale.tiling.EnhancedTile;
import de.kherud.upscale.tiling.MultiPassRefiner;
import de.kherud.upscale.tiling.Tile;
import de.kherud.upscale.tiling.TileDecomposer;
import de.kherud.upscale.tiling.TileMerger;
import de.kherud.upscale.tiling.TilePosition;
import de.kherud.upscale.tiling.TileScheduler;
import de.kherud.upscale.util.CliRunner;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Tiled image upscaler.
 *
 * An image is cut into overlapping tiles, every tile goes through an {@link EnhancementCapability}
 * with bounded concurrency, optional extra passes refine the tiles, and the tiles are blended back
 * into one image with feathered weights before a light post-processing stage.
 *
 * <pre>{@code
 * TileUpscaler upscaler = new TileUpscaler(UpscalerSettings.fromEnvironment());
 * UpscaleResponse response = upscaler.upscale(UpscaleRequest.builder(RasterImage.read(input)).build());
 * response.getImage().write(output);
 * }</pre>
 */
public class TileUpscaler {

	private static final System.Logger LOGGER = System.getLogger(TileUpscaler.class.getName());

	static final String FINAL_PASS_PROMPT = "Final refinement pass on the full image: ensure global consistency, "
		+ "remove any remaining tile seams or artifacts, unify textures and lighting across the image";

	private final EnhancementCapability capability;
	private final ImageAnalyzer analyzer;
	private final UpscalerSettings settings;

	public TileUpscaler(UpscalerSettings settings) {
		this(settings.createEnhancer(), settings.createAnalyzer(), settings);
	}

	/**
	 * @param capability enhancement applied to tiles
	 * @param analyzer image analysis, or null to use the default context
	 * @param settings concurrency and tile limit
	 */
	public TileUpscaler(EnhancementCapability capability, @Nullable ImageAnalyzer analyzer, UpscalerSettings settings) {
		if (capability == null) {
			throw new IllegalArgumentException("Enhancement capability cannot be null");
		}
		if (settings == null) {
			throw new IllegalArgumentException("Settings cannot be null");
		}
		this.capability = capability;
		this.analyzer = analyzer != null ? analyzer : ImageAnalyzer.defaults();
		this.settings = settings;
	}

	public UpscaleResponse upscale(UpscaleRequest request) {
		return upscale(request, null);
	}

	/**
	 * Run the full pipeline.
	 *
	 * @param request image and parameters
	 * @param progressListener optional per-tile progress callback, called from worker threads
	 * @return upscaled image and run statistics
	 * @throws UpscaleException {@code INVALID_PARAMETER}, {@code INVALID_IMAGE} or
	 *                          {@code TILE_LIMIT_EXCEEDED} before any capability call;
	 *                          {@code ENHANCEMENT_FAILED} or {@code TIMED_OUT} if a tile fails
	 */
	public UpscaleResponse upscale(UpscaleRequest request, @Nullable TileScheduler.ProgressListener progressListener) {
		if (request == null) {
			throw new IllegalArgumentException("Request cannot be null");
		}
		long start = System.nanoTime();
		request.validate();

		RasterImage image = request.getImage();
		int tileCount = TileDecomposer.countTiles(image.getWidth(), image.getHeight(),
			request.getTileSize(), request.getOverlap());
		if (tileCount > settings.getMaxTiles()) {
			throw new UpscaleException(UpscaleException.ErrorKind.TILE_LIMIT_EXCEEDED,
				String.format("Image %dx%d with tile size %d and overlap %d needs %d tiles, limit is %d",
					image.getWidth(), image.getHeight(), request.getTileSize(), request.getOverlap(),
					tileCount, settings.getMaxTiles()));
		}
		LOGGER.log(INFO, "Starting upscale: " + request);

		ImageAnalysis analysis = analyze(image);

		CountingCapability counting = new CountingCapability(capability);
		int concurrency = request.getConcurrency() != null ? request.getConcurrency() : settings.getConcurrency();
		TileScheduler scheduler = new TileScheduler(counting, concurrency, progressListener);

		Decomposition decomposition = TileDecomposer.decompose(image, request.getTileSize(), request.getOverlap());
		List<EnhancedTile> tiles = scheduler.enhanceAll(decomposition.getTiles(), request.getPrompt(),
			request.getUpscaleFactor(), analysis, image.getWidth(), image.getHeight());
		tiles = new MultiPassRefiner(scheduler).refine(tiles, request.getEnhancementPasses(), request.getPrompt());

		LOGGER.log(INFO, String.format("Merging %d tiles", tiles.size()));
		RasterImage merged = TileMerger.merge(tiles, image.getWidth(), image.getHeight(),
			request.getTileSize(), request.getOverlap(), request.getUpscaleFactor());

		if (request.isFinalPass()) {
			merged = finalPass(scheduler, merged, request.getPrompt());
		}

		PostProcessOptions options = PostProcessOptions.fromQualityKnobs(
			request.getSharpness(), request.getDenoise(), request.getContrast());
		LOGGER.log(DEBUG, "Post-processing with " + options);
		RasterImage result = PostProcessor.postProcess(merged, options);

		long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
		UpscaleResponse response = new UpscaleResponse(result, decomposition.size(), counting.getCalls(),
			capability.isRemote(), analysis, elapsedMillis);
		LOGGER.log(INFO, "Upscale complete: " + response);
		return response;
	}

	public UpscalerSettings getSettings() {
		return settings;
	}

	private ImageAnalysis analyze(RasterImage image) {
		try {
			ImageAnalysis analysis = analyzer.analyze(image);
			return analysis != null ? analysis : ImageAnalysis.defaults();
		} catch (RuntimeException e) {
			LOGGER.log(WARNING, "Image analysis failed, using default context: " + e.getMessage(), e);
			return ImageAnalysis.defaults();
		}
	}

	/**
	 * One more call over the merged canvas at scale 1, run as a single-tile batch so failures are
	 * reported like any tile failure.
	 */
	private static RasterImage finalPass(TileScheduler scheduler, RasterImage merged, String prompt) {
		LOGGER.log(INFO, "Running final consistency pass");
		Tile whole = new Tile(0, 0, merged.getWidth(), merged.getHeight(), merged);
		List<EnhancedTile> refined = scheduler.refineAll(
			Collections.singletonList(new EnhancedTile(whole, merged)), FINAL_PASS_PROMPT + ". " + prompt);
		return refined.get(0).getEnhanced();
	}

	private static final class CountingCapability implements EnhancementCapability {
		private final EnhancementCapability delegate;
		private final AtomicInteger calls = new AtomicInteger();

		CountingCapability(EnhancementCapability delegate) {
			this.delegate = delegate;
		}

		@Override
		public RasterImage enhance(RasterImage image, String prompt, double upscaleFactor, @Nullable TileContext context)
			throws IOException, InterruptedException {
			calls.incrementAndGet();
			return delegate.enhance(image, prompt, upscaleFactor, context);
		}

		@Override
		public boolean isRemote() {
			return delegate.isRemote();
		}

		int getCalls() {
			return calls.get();
		}
	}

	public static void main(String[] args) {
		CliRunner.runWithExit(TileUpscaler::runCli, args);
	}

	/**
	 * CLI entry point that can be tested without System.exit.
	 */
	public static void runCli(String[] args) throws Exception {
		if (args.length == 0) {
			printUsage();
			throw new IllegalArgumentException("No command specified");
		}
		switch (args[0]) {
			case "upscale":
				runUpscale(args);
				break;
			case "tiles":
				runTiles(args);
				break;
			case "--help":
			case "-h":
				printUsage();
				break;
			default:
				printUsage();
				throw new IllegalArgumentException("Unknown command: " + args[0]);
		}
	}

	private static void runUpscale(String[] args) throws Exception {
		String input = null;
		String output = null;
		String config = null;
		boolean verbose = false;
		int tileSize = UpscaleRequest.DEFAULT_TILE_SIZE;
		int overlap = UpscaleRequest.DEFAULT_OVERLAP;
		double scale = UpscaleRequest.DEFAULT_UPSCALE_FACTOR;
		String prompt = UpscaleRequest.DEFAULT_PROMPT;
		int passes = 1;
		int sharpness = 50;
		int denoise = 0;
		int contrast = 50;
		boolean finalPass = false;
		Integer concurrency = null;

		for (int i = 1; i < args.length; i++) {
			switch (args[i]) {
				case "--tile-size":
					tileSize = Integer.parseInt(requireValue(args, i++));
					break;
				case "--overlap":
					overlap = Integer.parseInt(requireValue(args, i++));
					break;
				case "--scale":
					scale = Double.parseDouble(requireValue(args, i++));
					break;
				case "--prompt":
					prompt = requireValue(args, i++);
					break;
				case "--passes":
					passes = Integer.parseInt(requireValue(args, i++));
					break;
				case "--sharpness":
					sharpness = Integer.parseInt(requireValue(args, i++));
					break;
				case "--denoise":
					denoise = Integer.parseInt(requireValue(args, i++));
					break;
				case "--contrast":
					contrast = Integer.parseInt(requireValue(args, i++));
					break;
				case "--concurrency":
					concurrency = Integer.parseInt(requireValue(args, i++));
					break;
				case "--config":
					config = requireValue(args, i++);
					break;
				case "--final-pass":
					finalPass = true;
					break;
				case "--verbose":
				case "-v":
					verbose = true;
					break;
				default:
					if (args[i].startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + args[i]);
					}
					if (input == null) {
						input = args[i];
					} else if (output == null) {
						output = args[i];
					} else {
						throw new IllegalArgumentException("Unexpected argument: " + args[i]);
					}
			}
		}
		if (input == null || output == null) {
			printUsage();
			throw new IllegalArgumentException("upscale needs an input and an output path");
		}

		Path inputPath = Paths.get(input);
		if (!Files.exists(inputPath)) {
			throw new IllegalArgumentException("Input file not found: " + input);
		}
		UpscalerSettings settings = config != null
			? UpscalerSettings.fromJson(Paths.get(config))
			: UpscalerSettings.fromEnvironment();
		if (verbose) {
			System.out.println("Settings: " + settings);
		}

		UpscaleRequest.Builder builder = UpscaleRequest.builder(RasterImage.read(inputPath))
			.tileSize(tileSize)
			.overlap(overlap)
			.upscaleFactor(scale)
			.prompt(prompt)
			.enhancementPasses(passes)
			.sharpness(sharpness)
			.denoise(denoise)
			.contrast(contrast)
			.finalPass(finalPass)
			.concurrency(concurrency);

		TileScheduler.ProgressListener listener = verbose
			? (done, total) -> System.out.println("Tile " + done + "/" + total + " done")
			: null;
		UpscaleResponse response = new TileUpscaler(settings).upscale(builder.build(), listener);

		Path outputPath = Paths.get(output);
		if (outputPath.getParent() != null) {
			Files.createDirectories(outputPath.getParent());
		}
		response.getImage().write(outputPath);
		System.out.println(response.toSummaryJson());
	}

	private static void runTiles(String[] args) throws Exception {
		String input = null;
		int tileSize = UpscaleRequest.DEFAULT_TILE_SIZE;
		int overlap = UpscaleRequest.DEFAULT_OVERLAP;

		for (int i = 1; i < args.length; i++) {
			switch (args[i]) {
				case "--tile-size":
					tileSize = Integer.parseInt(requireValue(args, i++));
					break;
				case "--overlap":
					overlap = Integer.parseInt(requireValue(args, i++));
					break;
				default:
					if (args[i].startsWith("-") || input != null) {
						throw new IllegalArgumentException("Unexpected argument: " + args[i]);
					}
					input = args[i];
			}
		}
		if (input == null) {
			printUsage();
			throw new IllegalArgumentException("tiles needs an input path");
		}
		Path inputPath = Paths.get(input);
		if (!Files.exists(inputPath)) {
			throw new IllegalArgumentException("Input file not found: " + input);
		}

		RasterImage image = RasterImage.read(inputPath);
		Decomposition decomposition = TileDecomposer.decompose(image, tileSize, overlap);
		System.out.printf("%dx%d image, tile size %d, overlap %d: %d tiles%n",
			image.getWidth(), image.getHeight(), tileSize, overlap, decomposition.size());
		List<Tile> tiles = decomposition.getTiles();
		for (int i = 0; i < tiles.size(); i++) {
			Tile tile = tiles.get(i);
			System.out.printf("  #%d x=%d y=%d %dx%d (%s)%n", i, tile.getX(), tile.getY(),
				tile.getWidth(), tile.getHeight(), TilePosition.describe(tile, image.getWidth(), image.getHeight()));
		}
	}

	private static String requireValue(String[] args, int optionIndex) {
		if (optionIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + args[optionIndex]);
		}
		return args[optionIndex + 1];
	}

	private static void printUsage() {
		System.out.println("Usage:");
		System.out.println("  TileUpscaler upscale <input> <output> [options]");
		System.out.println("  TileUpscaler tiles <input> [--tile-size N] [--overlap N]");
		System.out.println();
		System.out.println("Options:");
		System.out.println("  --tile-size N      Tile edge in source pixels (default 256)");
		System.out.println("  --overlap N        Overlap between neighbouring tiles (default 64)");
		System.out.println("  --scale F          Upscale factor (default 2.0)");
		System.out.println("  --prompt S         Enhancement guidance");
		System.out.println("  --passes N         Enhancement passes, 1 to 3 (default 1)");
		System.out.println("  --sharpness N      0 to 100 (default 50)");
		System.out.println("  --denoise N        0 to 100 (default 0)");
		System.out.println("  --contrast N       0 to 100 (default 50)");
		System.out.println("  --concurrency N    Simultaneous enhancement calls");
		System.out.println("  --config FILE      JSON settings file (default: system properties and environment)");
		System.out.println("  --final-pass       Run one more pass over the merged image");
		System.out.println("  -v, --verbose      Print settings and per-tile progress");
	}
}
