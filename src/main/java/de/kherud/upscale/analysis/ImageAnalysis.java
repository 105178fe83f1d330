package de.kherud.upscale.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.kherud.upscale.enhance.TileContext;

import java.util.Collections;
import java.util.List;

/**
 * What an image analysis found in the whole image. Used only to build per-tile enhancement context.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ImageAnalysis {

	public static final String DEFAULT_DESCRIPTION = "Image content";

	private static final List<String> DEFAULT_TEXTURES = Collections.singletonList("general");
	private static final List<String> DEFAULT_SUBJECTS = Collections.singletonList("unknown");
	private static final ImageAnalysis DEFAULTS = new ImageAnalysis(DEFAULT_DESCRIPTION, DEFAULT_TEXTURES, DEFAULT_SUBJECTS);

	private final String description;
	private final List<String> textures;
	private final List<String> subjects;

	@JsonCreator
	public ImageAnalysis(@JsonProperty("description") String description,
						 @JsonProperty("textures") List<String> textures,
						 @JsonProperty("subjects") List<String> subjects) {
		this.description = description == null || description.isBlank() ? DEFAULT_DESCRIPTION : description;
		this.textures = textures == null ? DEFAULT_TEXTURES : List.copyOf(textures);
		this.subjects = subjects == null ? DEFAULT_SUBJECTS : List.copyOf(subjects);
	}

	/**
	 * Context used when no analysis capability is configured or the analysis failed.
	 */
	public static ImageAnalysis defaults() {
		return DEFAULTS;
	}

	public String getDescription() {
		return description;
	}

	public List<String> getTextures() {
		return textures;
	}

	public List<String> getSubjects() {
		return subjects;
	}

	public TileContext toContext(String position) {
		return new TileContext(position, description, textures, subjects);
	}

	@Override
	public String toString() {
		return "ImageAnalysis{description='" + description + "', textures=" + textures + ", subjects=" + subjects + "}";
	}
}
