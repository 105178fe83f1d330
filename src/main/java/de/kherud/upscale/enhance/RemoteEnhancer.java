package de.kherud.upscale.enhance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.kherud.upscale.UpscaleException;
import de.kherud.upscale.image.RasterImage;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Enhancement through a remote image model over HTTP.
 *
 * Each call posts a JSON document
 * <pre>{@code
 * {"image": "<base64 png>", "mimeType": "image/png", "prompt": "...", "upscaleFactor": 2.0,
 *  "context": {"position": "...", "imageDescription": "...", "textures": [...], "subjects": [...]}}
 * }</pre>
 * and expects {@code {"image": "<base64>"}} back ({@code imageBase64} is accepted as well).
 * A response whose size differs from the expected size is resampled to it. A request that exceeds
 * the configured timeout fails with {@link java.net.http.HttpTimeoutException}.
 */
public class RemoteEnhancer implements EnhancementCapability {

	private static final System.Logger LOGGER = System.getLogger(RemoteEnhancer.class.getName());
	private static final ObjectMapper MAPPER = new ObjectMapper();

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

	private final URI endpoint;
	private final String apiKey;
	private final Duration requestTimeout;
	private final HttpClient httpClient;

	public RemoteEnhancer(String endpoint, @Nullable String apiKey) {
		this(endpoint, apiKey, DEFAULT_TIMEOUT);
	}

	/**
	 * @param endpoint URL the enhancement requests are posted to
	 * @param apiKey value of the {@code x-api-key} header, or null to send none
	 * @param requestTimeout per-request deadline
	 */
	public RemoteEnhancer(String endpoint, @Nullable String apiKey, Duration requestTimeout) {
		if (endpoint == null || endpoint.trim().isEmpty()) {
			throw new IllegalArgumentException("Enhancer endpoint cannot be null or empty");
		}
		if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
			throw new IllegalArgumentException("Request timeout must be positive");
		}
		this.endpoint = URI.create(endpoint.trim());
		this.apiKey = apiKey;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.build();
	}

	@Override
	public RasterImage enhance(RasterImage image, String prompt, double upscaleFactor, @Nullable TileContext context)
		throws IOException, InterruptedException {
		int expectedWidth = EnhancementCapability.scaledSize(image.getWidth(), upscaleFactor);
		int expectedHeight = EnhancementCapability.scaledSize(image.getHeight(), upscaleFactor);

		ObjectNode body = MAPPER.createObjectNode();
		body.put("image", Base64.getEncoder().encodeToString(image.toPng()));
		body.put("mimeType", "image/png");
		body.put("prompt", PromptBuilder.build(prompt, context));
		body.put("upscaleFactor", upscaleFactor);
		if (context != null) {
			body.set("context", MAPPER.valueToTree(context));
		}

		HttpRequest.Builder request = HttpRequest.newBuilder()
			.uri(endpoint)
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
			.timeout(requestTimeout);
		if (apiKey != null && !apiKey.isEmpty()) {
			request.header("x-api-key", apiKey);
		}

		HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
		if (response.statusCode() / 100 != 2) {
			throw new IOException("Enhancer returned status " + response.statusCode() + ": " + response.body());
		}

		RasterImage enhanced;
		try {
			enhanced = RasterImage.decode(Base64.getDecoder().decode(extractImage(response.body())));
		} catch (IllegalArgumentException | UpscaleException e) {
			throw new IOException("Enhancer returned an unreadable image: " + e.getMessage(), e);
		}
		if (enhanced.getWidth() != expectedWidth || enhanced.getHeight() != expectedHeight) {
			LOGGER.log(WARNING, String.format("Enhancer returned %dx%d, expected %dx%d; resampling",
				enhanced.getWidth(), enhanced.getHeight(), expectedWidth, expectedHeight));
			enhanced = enhanced.resize(expectedWidth, expectedHeight);
		}
		LOGGER.log(DEBUG, String.format("Remote enhancement: %dx%d -> %dx%d", image.getWidth(), image.getHeight(),
			expectedWidth, expectedHeight));
		return enhanced;
	}

	@Override
	public boolean isRemote() {
		return true;
	}

	public URI getEndpoint() {
		return endpoint;
	}

	static String extractImage(String responseBody) throws IOException {
		JsonNode root = MAPPER.readTree(responseBody);
		JsonNode image = root.path("image");
		if (!image.isTextual()) {
			image = root.path("imageBase64");
		}
		if (!image.isTextual() || image.asText().isEmpty()) {
			throw new IOException("Enhancer response contains no image");
		}
		return image.asText();
	}
}
