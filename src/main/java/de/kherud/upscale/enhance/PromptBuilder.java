package de.kherud.upscale.enhance;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the text prompt sent with a tile to a remote enhancement model.
 *
 * With a {@link TileContext} the prompt names the tile position, the image description and
 * subjects, and adds texture-specific detail instructions. Without one, a generic photorealistic
 * regeneration prompt is used. The caller's own prompt is always appended last.
 */
public final class PromptBuilder {

	private static final Map<String, String> TEXTURE_INSTRUCTIONS = new LinkedHashMap<>();

	static {
		TEXTURE_INSTRUCTIONS.put("hair", "Render hair with individual strands, natural shine and colour variation.");
		TEXTURE_INSTRUCTIONS.put("skin", "Render skin with fine pores, subtle lines and natural tone variation, without harsh sharpening.");
		TEXTURE_INSTRUCTIONS.put("eye", "Render eyes with iris detail, natural catchlights and individual lashes.");
		TEXTURE_INSTRUCTIONS.put("fabric", "Render fabric with visible weave, thread texture and natural creases.");
		TEXTURE_INSTRUCTIONS.put("leather", "Render leather with natural grain, pores and wear.");
		TEXTURE_INSTRUCTIONS.put("metal", "Render metal with accurate reflections, fine scratches and patina.");
		TEXTURE_INSTRUCTIONS.put("wood", "Render wood with grain, knots and natural colour variation.");
		TEXTURE_INSTRUCTIONS.put("stone", "Render stone with mineral patterns, cracks and weathering.");
		TEXTURE_INSTRUCTIONS.put("glass", "Render glass with clean reflections, refraction and small imperfections.");
		TEXTURE_INSTRUCTIONS.put("water", "Render water with ripples, reflections and transparency.");
		TEXTURE_INSTRUCTIONS.put("grass", "Render grass with individual blades and natural depth.");
		TEXTURE_INSTRUCTIONS.put("fur", "Render fur with directional strands and a soft underlayer.");
		TEXTURE_INSTRUCTIONS.put("feather", "Render feathers with individual barbs and natural patterns.");
		TEXTURE_INSTRUCTIONS.put("foliage", "Render foliage with leaf veins and natural variation.");
		TEXTURE_INSTRUCTIONS.put("sky", "Render sky with smooth gradients and natural cloud detail.");
		TEXTURE_INSTRUCTIONS.put("face", "Render facial features with natural texture and realistic depth.");
	}

	static final String GENERIC_TEXTURE_INSTRUCTION =
		"Render every surface with photorealistic micro-texture and natural imperfections.";

	private static final String CORE_INSTRUCTIONS = String.join(" ",
		"Regenerate this low-quality image region as a high-quality photograph.",
		"Keep the same subject, pose, composition, lighting direction and colours.",
		"Add the fine detail a high-end camera would capture; do not change the content.");

	private PromptBuilder() {
		throw new AssertionError("Utility class should not be instantiated");
	}

	public static String build(String userPrompt, @Nullable TileContext context) {
		StringBuilder prompt = new StringBuilder();
		if (context != null) {
			prompt.append("Context: this tile is from the ").append(context.getPosition())
				.append(" of an image showing: ").append(context.getImageDescription()).append(". ");
			if (!context.getSubjects().isEmpty()) {
				prompt.append("Main subjects: ").append(String.join(", ", context.getSubjects())).append(". ");
			}
			if (!context.getTextures().isEmpty()) {
				prompt.append("Textures: ").append(String.join(", ", context.getTextures())).append(". ");
			}
			prompt.append(CORE_INSTRUCTIONS).append(' ').append(textureInstructions(context.getTextures()));
		} else {
			prompt.append(CORE_INSTRUCTIONS).append(' ').append(GENERIC_TEXTURE_INSTRUCTION);
		}
		if (userPrompt != null && !userPrompt.isBlank()) {
			prompt.append(" Additional: ").append(userPrompt.trim());
		}
		return prompt.toString();
	}

	/**
	 * One instruction per recognised texture, in the order the textures are listed.
	 */
	static String textureInstructions(List<String> textures) {
		List<String> instructions = new ArrayList<>();
		for (String texture : textures) {
			String lower = texture.toLowerCase(Locale.ROOT);
			for (Map.Entry<String, String> entry : TEXTURE_INSTRUCTIONS.entrySet()) {
				if (lower.contains(entry.getKey())) {
					if (!instructions.contains(entry.getValue())) {
						instructions.add(entry.getValue());
					}
					break;
				}
			}
		}
		return instructions.isEmpty() ? GENERIC_TEXTURE_INSTRUCTION : String.join(" ", instructions);
	}
}
