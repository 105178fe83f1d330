package de.kherud.upscale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.upscale.analysis.ImageAnalyzer;
import de.kherud.upscale.analysis.RemoteImageAnalyzer;
import de.kherud.upscale.enhance.EnhancementCapability;
import de.kherud.upscale.enhance.LocalEnhancer;
import de.kherud.upscale.enhance.RemoteEnhancer;
import de.kherud.upscale.tiling.TileScheduler;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Process-wide configuration of the upscaler: which capabilities to use and the resource limits.
 *
 * Settings come from a builder, from system properties with environment fallback
 * ({@link #fromEnvironment()}) or from a JSON file ({@link #fromJson(Path)}):
 *
 * <pre>{@code
 * {
 *   "enhancerUrl": "http://localhost:8080/enhance",
 *   "enhancerKey": "secret",
 *   "analyzerUrl": "https://.../models/gemini:generateContent",
 *   "concurrency": 4,
 *   "maxTiles": 500,
 *   "requestTimeoutSeconds": 120,
 *   "analysisTimeoutSeconds": 30
 * }
 * }</pre>
 */
public final class UpscalerSettings {

	public static final int DEFAULT_MAX_TILES = 500;
	public static final Duration DEFAULT_REQUEST_TIMEOUT = RemoteEnhancer.DEFAULT_TIMEOUT;
	public static final Duration DEFAULT_ANALYSIS_TIMEOUT = RemoteImageAnalyzer.DEFAULT_TIMEOUT;

	static final String ENHANCER_URL = "upscale.enhancer.url";
	static final String ENHANCER_KEY = "upscale.enhancer.key";
	static final String ANALYZER_URL = "upscale.analyzer.url";
	static final String ANALYZER_KEY = "upscale.analyzer.key";
	static final String CONCURRENCY = "upscale.concurrency";
	static final String MAX_TILES = "upscale.maxTiles";
	static final String REQUEST_TIMEOUT = "upscale.requestTimeoutSeconds";
	static final String ANALYSIS_TIMEOUT = "upscale.analysisTimeoutSeconds";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String enhancerUrl;
	private final String enhancerKey;
	private final String analyzerUrl;
	private final String analyzerKey;
	private final int concurrency;
	private final int maxTiles;
	private final Duration requestTimeout;
	private final Duration analysisTimeout;

	private UpscalerSettings(Builder builder) {
		this.enhancerUrl = builder.enhancerUrl;
		this.enhancerKey = builder.enhancerKey;
		this.analyzerUrl = builder.analyzerUrl;
		this.analyzerKey = builder.analyzerKey;
		this.concurrency = builder.concurrency;
		this.maxTiles = builder.maxTiles;
		this.requestTimeout = builder.requestTimeout;
		this.analysisTimeout = builder.analysisTimeout;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Local enhancement, no analysis, default limits.
	 */
	public static UpscalerSettings defaults() {
		return builder().build();
	}

	public static UpscalerSettings fromEnvironment() {
		return fromSources(System.getProperties(), System.getenv());
	}

	/**
	 * System property first, then the environment variable derived from it
	 * ({@code upscale.enhancer.url} becomes {@code UPSCALE_ENHANCER_URL}).
	 */
	static UpscalerSettings fromSources(Properties properties, Map<String, String> environment) {
		Builder builder = builder();
		String value;
		if ((value = lookup(properties, environment, ENHANCER_URL)) != null) {
			builder.enhancerUrl(value);
		}
		if ((value = lookup(properties, environment, ENHANCER_KEY)) != null) {
			builder.enhancerKey(value);
		}
		if ((value = lookup(properties, environment, ANALYZER_URL)) != null) {
			builder.analyzerUrl(value);
		}
		if ((value = lookup(properties, environment, ANALYZER_KEY)) != null) {
			builder.analyzerKey(value);
		}
		if ((value = lookup(properties, environment, CONCURRENCY)) != null) {
			builder.concurrency(parseInt(CONCURRENCY, value));
		}
		if ((value = lookup(properties, environment, MAX_TILES)) != null) {
			builder.maxTiles(parseInt(MAX_TILES, value));
		}
		if ((value = lookup(properties, environment, REQUEST_TIMEOUT)) != null) {
			builder.requestTimeout(Duration.ofSeconds(parseInt(REQUEST_TIMEOUT, value)));
		}
		if ((value = lookup(properties, environment, ANALYSIS_TIMEOUT)) != null) {
			builder.analysisTimeout(Duration.ofSeconds(parseInt(ANALYSIS_TIMEOUT, value)));
		}
		return builder.build();
	}

	/**
	 * Read settings from a JSON file. Missing fields keep their defaults, unknown fields are ignored.
	 *
	 * @throws IllegalArgumentException if the file is missing, is not valid JSON or holds no JSON object
	 * @throws IOException if the file exists but cannot be read
	 */
	public static UpscalerSettings fromJson(Path path) throws IOException {
		if (!Files.isRegularFile(path)) {
			throw new IllegalArgumentException("Settings file not found: " + path);
		}
		JsonNode root;
		try {
			root = MAPPER.readTree(path.toFile());
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Settings file is not valid JSON: " + path, e);
		}
		if (root == null || !root.isObject()) {
			throw new IllegalArgumentException("Settings file must contain a JSON object: " + path);
		}

		Builder builder = builder();
		if (root.hasNonNull("enhancerUrl")) {
			builder.enhancerUrl(root.get("enhancerUrl").asText());
		}
		if (root.hasNonNull("enhancerKey")) {
			builder.enhancerKey(root.get("enhancerKey").asText());
		}
		if (root.hasNonNull("analyzerUrl")) {
			builder.analyzerUrl(root.get("analyzerUrl").asText());
		}
		if (root.hasNonNull("analyzerKey")) {
			builder.analyzerKey(root.get("analyzerKey").asText());
		}
		if (root.hasNonNull("concurrency")) {
			builder.concurrency(root.get("concurrency").asInt());
		}
		if (root.hasNonNull("maxTiles")) {
			builder.maxTiles(root.get("maxTiles").asInt());
		}
		if (root.hasNonNull("requestTimeoutSeconds")) {
			builder.requestTimeout(Duration.ofSeconds(root.get("requestTimeoutSeconds").asLong()));
		}
		if (root.hasNonNull("analysisTimeoutSeconds")) {
			builder.analysisTimeout(Duration.ofSeconds(root.get("analysisTimeoutSeconds").asLong()));
		}
		return builder.build();
	}

	/**
	 * {@link RemoteEnhancer} when an enhancer URL is configured, otherwise {@link LocalEnhancer}.
	 */
	public EnhancementCapability createEnhancer() {
		if (enhancerUrl != null) {
			return new RemoteEnhancer(enhancerUrl, enhancerKey, requestTimeout);
		}
		return new LocalEnhancer();
	}

	/**
	 * {@link RemoteImageAnalyzer} when an analyzer URL is configured, otherwise the default analysis.
	 */
	public ImageAnalyzer createAnalyzer() {
		if (analyzerUrl != null) {
			return new RemoteImageAnalyzer(analyzerUrl, analyzerKey, analysisTimeout);
		}
		return ImageAnalyzer.defaults();
	}

	@Nullable
	public String getEnhancerUrl() {
		return enhancerUrl;
	}

	@Nullable
	public String getAnalyzerUrl() {
		return analyzerUrl;
	}

	public int getConcurrency() {
		return concurrency;
	}

	public int getMaxTiles() {
		return maxTiles;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public Duration getAnalysisTimeout() {
		return analysisTimeout;
	}

	@Override
	public String toString() {
		// keys stay out of logs
		return "UpscalerSettings{enhancer=" + (enhancerUrl != null ? enhancerUrl : "local")
			+ ", analyzer=" + (analyzerUrl != null ? analyzerUrl : "none")
			+ ", concurrency=" + concurrency
			+ ", maxTiles=" + maxTiles
			+ ", requestTimeout=" + requestTimeout.getSeconds() + "s"
			+ ", analysisTimeout=" + analysisTimeout.getSeconds() + "s}";
	}

	private static String lookup(Properties properties, Map<String, String> environment, String key) {
		String value = properties.getProperty(key);
		if (value == null || value.isBlank()) {
			value = environment.get(environmentName(key));
		}
		return value == null || value.isBlank() ? null : value.trim();
	}

	static String environmentName(String key) {
		return key.replaceAll("([a-z])([A-Z])", "$1_$2").replace('.', '_').toUpperCase(Locale.ROOT);
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Setting " + key + " must be an integer, got '" + value + "'", e);
		}
	}

	public static class Builder {
		private String enhancerUrl;
		private String enhancerKey;
		private String analyzerUrl;
		private String analyzerKey;
		private int concurrency = TileScheduler.DEFAULT_CONCURRENCY;
		private int maxTiles = DEFAULT_MAX_TILES;
		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
		private Duration analysisTimeout = DEFAULT_ANALYSIS_TIMEOUT;

		public Builder enhancerUrl(@Nullable String enhancerUrl) {
			this.enhancerUrl = blankToNull(enhancerUrl);
			return this;
		}

		public Builder enhancerKey(@Nullable String enhancerKey) {
			this.enhancerKey = blankToNull(enhancerKey);
			return this;
		}

		public Builder analyzerUrl(@Nullable String analyzerUrl) {
			this.analyzerUrl = blankToNull(analyzerUrl);
			return this;
		}

		public Builder analyzerKey(@Nullable String analyzerKey) {
			this.analyzerKey = blankToNull(analyzerKey);
			return this;
		}

		public Builder concurrency(int concurrency) {
			if (concurrency < 1) {
				throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
			}
			this.concurrency = concurrency;
			return this;
		}

		public Builder maxTiles(int maxTiles) {
			if (maxTiles < 1) {
				throw new IllegalArgumentException("Tile limit must be at least 1, got " + maxTiles);
			}
			this.maxTiles = maxTiles;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requirePositive("Request timeout", requestTimeout);
			return this;
		}

		public Builder analysisTimeout(Duration analysisTimeout) {
			this.analysisTimeout = requirePositive("Analysis timeout", analysisTimeout);
			return this;
		}

		public UpscalerSettings build() {
			return new UpscalerSettings(this);
		}

		private static String blankToNull(String value) {
			return value == null || value.isBlank() ? null : value.trim();
		}

		private static Duration requirePositive(String name, Duration duration) {
			if (duration == null || duration.isZero() || duration.isNegative()) {
				throw new IllegalArgumentException(name + " must be positive");
			}
			return duration;
		}
	}
}
