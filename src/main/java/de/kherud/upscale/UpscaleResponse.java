package de.kherud.upscale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.upscale.analysis.ImageAnalysis;
import de.kherud.upscale.image.RasterImage;

import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a successful upscale run.
 */
public final class UpscaleResponse {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final RasterImage image;
	private final int tilesProcessed;
	private final int enhancementCalls;
	private final boolean aiEnhanced;
	private final ImageAnalysis analysis;
	private final long elapsedMillis;

	UpscaleResponse(RasterImage image, int tilesProcessed, int enhancementCalls, boolean aiEnhanced,
					ImageAnalysis analysis, long elapsedMillis) {
		this.image = image;
		this.tilesProcessed = tilesProcessed;
		this.enhancementCalls = enhancementCalls;
		this.aiEnhanced = aiEnhanced;
		this.analysis = analysis;
		this.elapsedMillis = elapsedMillis;
	}

	public RasterImage getImage() {
		return image;
	}

	public int getWidth() {
		return image.getWidth();
	}

	public int getHeight() {
		return image.getHeight();
	}

	public int getTilesProcessed() {
		return tilesProcessed;
	}

	/**
	 * Calls made to the enhancement capability, over all passes and the final pass.
	 */
	public int getEnhancementCalls() {
		return enhancementCalls;
	}

	public boolean isAiEnhanced() {
		return aiEnhanced;
	}

	public ImageAnalysis getAnalysis() {
		return analysis;
	}

	public long getElapsedMillis() {
		return elapsedMillis;
	}

	/**
	 * The image as a {@code data:image/png;base64,...} URL.
	 */
	public String toDataUrl() throws IOException {
		return "data:image/png;base64," + Base64.getEncoder().encodeToString(image.toPng());
	}

	public Map<String, Object> toSummary() {
		Map<String, Object> summary = new LinkedHashMap<>();
		summary.put("width", getWidth());
		summary.put("height", getHeight());
		summary.put("tilesProcessed", tilesProcessed);
		summary.put("enhancementCalls", enhancementCalls);
		summary.put("aiEnhanced", aiEnhanced);
		summary.put("elapsedMillis", elapsedMillis);
		Map<String, Object> analysisSummary = new LinkedHashMap<>();
		analysisSummary.put("description", analysis.getDescription());
		analysisSummary.put("textures", analysis.getTextures());
		analysisSummary.put("subjects", analysis.getSubjects());
		summary.put("analysis", analysisSummary);
		return summary;
	}

	public String toSummaryJson() throws JsonProcessingException {
		return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toSummary());
	}

	@Override
	public String toString() {
		return String.format("UpscaleResponse{%dx%d, tiles=%d, calls=%d, aiEnhanced=%s, %dms}",
			getWidth(), getHeight(), tilesProcessed, enhancementCalls, aiEnhanced, elapsedMillis);
	}
}
