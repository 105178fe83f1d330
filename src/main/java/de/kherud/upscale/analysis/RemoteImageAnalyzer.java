package de.kherud.upscale.analysis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.kherud.upscale.image.RasterImage;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Image analysis through a multimodal model speaking the Gemini {@code generateContent} format.
 *
 * The image is shrunk to fit 512x512, sent as JPEG with an instruction to answer in JSON, and the
 * first JSON object found in the first text part of the first candidate is mapped onto
 * {@link ImageAnalysis}. Every failure is logged and answered with {@link ImageAnalysis#defaults()}.
 */
public class RemoteImageAnalyzer implements ImageAnalyzer {

	private static final System.Logger LOGGER = System.getLogger(RemoteImageAnalyzer.class.getName());
	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
	private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	static final int MAX_ANALYSIS_SIZE = 512;

	static final String ANALYSIS_PROMPT = String.join("\n",
		"Analyze this image. Respond with this exact JSON format only, no other text:",
		"{\"description\": \"a brief description of the image\",",
		" \"textures\": [\"textures\", \"present\"],",
		" \"subjects\": [\"main\", \"subjects\"]}",
		"Textures include hair, skin, eyes, fabric, leather, metal, wood, stone, glass, water, grass, fur,",
		"feathers, foliage, sky and similar. Subjects include person, face, animal, building, landscape,",
		"object, food, vehicle and similar.");

	private final URI endpoint;
	private final String apiKey;
	private final Duration timeout;
	private final HttpClient httpClient;

	public RemoteImageAnalyzer(String endpoint, @Nullable String apiKey) {
		this(endpoint, apiKey, DEFAULT_TIMEOUT);
	}

	public RemoteImageAnalyzer(String endpoint, @Nullable String apiKey, Duration timeout) {
		if (endpoint == null || endpoint.trim().isEmpty()) {
			throw new IllegalArgumentException("Analyzer endpoint cannot be null or empty");
		}
		this.endpoint = URI.create(endpoint.trim());
		this.apiKey = apiKey;
		this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(10))
			.build();
	}

	@Override
	public ImageAnalysis analyze(RasterImage image) {
		try {
			ImageAnalysis analysis = parseResponse(post(buildPayload(image)));
			LOGGER.log(INFO, "Image analysis: " + analysis);
			return analysis;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			LOGGER.log(WARNING, "Image analysis interrupted, using default context");
		} catch (Exception e) {
			LOGGER.log(WARNING, "Image analysis failed, using default context: " + e.getMessage(), e);
		}
		return ImageAnalysis.defaults();
	}

	private String buildPayload(RasterImage image) throws IOException {
		RasterImage small = fitInside(image, MAX_ANALYSIS_SIZE);

		ObjectNode payload = MAPPER.createObjectNode();
		ArrayNode parts = payload.putArray("contents").addObject().putArray("parts");
		ObjectNode inline = parts.addObject().putObject("inline_data");
		inline.put("mime_type", "image/jpeg");
		inline.put("data", Base64.getEncoder().encodeToString(small.encode("jpg")));
		parts.addObject().put("text", ANALYSIS_PROMPT);
		payload.putObject("generationConfig").putArray("responseModalities").add("TEXT");
		return MAPPER.writeValueAsString(payload);
	}

	private String post(String payload) throws IOException, InterruptedException {
		HttpRequest.Builder request = HttpRequest.newBuilder()
			.uri(endpoint)
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(payload))
			.timeout(timeout);
		if (apiKey != null && !apiKey.isEmpty()) {
			request.header("x-goog-api-key", apiKey);
		}

		HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
		if (response.statusCode() != 200) {
			throw new IOException("Analyzer returned status " + response.statusCode() + ": " + response.body());
		}
		return response.body();
	}

	/**
	 * Extract the analysis from a {@code generateContent} response body.
	 *
	 * @throws IOException if the body has no candidate text or the text holds no JSON object
	 */
	static ImageAnalysis parseResponse(String body) throws IOException {
		JsonNode candidates = MAPPER.readTree(body).path("candidates");
		if (!candidates.isArray() || candidates.isEmpty()) {
			throw new IOException("No analysis candidates in response");
		}

		String text = null;
		for (JsonNode part : candidates.get(0).path("content").path("parts")) {
			if (part.path("text").isTextual()) {
				text = part.path("text").asText();
				break;
			}
		}
		if (text == null) {
			throw new IOException("No text in analysis response");
		}

		Matcher matcher = JSON_OBJECT.matcher(text);
		if (!matcher.find()) {
			throw new IOException("No JSON object in analysis text");
		}
		JsonNode parsed = MAPPER.readTree(matcher.group());
		return new ImageAnalysis(
			parsed.path("description").isTextual() ? parsed.path("description").asText() : null,
			parsed.path("textures").isArray() ? MAPPER.convertValue(parsed.get("textures"), STRING_LIST) : null,
			parsed.path("subjects").isArray() ? MAPPER.convertValue(parsed.get("subjects"), STRING_LIST) : null);
	}

	static RasterImage fitInside(RasterImage image, int maxSize) {
		int w = image.getWidth();
		int h = image.getHeight();
		if (w <= maxSize && h <= maxSize) {
			return image;
		}
		double ratio = Math.min((double) maxSize / w, (double) maxSize / h);
		return image.resize(Math.max(1, (int) Math.round(w * ratio)), Math.max(1, (int) Math.round(h * ratio)));
	}
}
