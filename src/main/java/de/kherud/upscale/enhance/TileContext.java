package de.kherud.upscale.enhance;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Read-only context handed to an {@link EnhancementCapability} together with a tile: where the
 * tile sits in the image and what the analysis found in the image as a whole.
 */
public final class TileContext {

	@JsonProperty("position")
	private final String position;
	@JsonProperty("imageDescription")
	private final String imageDescription;
	@JsonProperty("textures")
	private final List<String> textures;
	@JsonProperty("subjects")
	private final List<String> subjects;

	public TileContext(String position, String imageDescription, List<String> textures, List<String> subjects) {
		this.position = position;
		this.imageDescription = imageDescription;
		this.textures = textures == null ? Collections.emptyList() : List.copyOf(textures);
		this.subjects = subjects == null ? Collections.emptyList() : List.copyOf(subjects);
	}

	public String getPosition() {
		return position;
	}

	public String getImageDescription() {
		return imageDescription;
	}

	public List<String> getTextures() {
		return textures;
	}

	public List<String> getSubjects() {
		return subjects;
	}

	/**
	 * @return true if any texture contains one of the given keywords, ignoring case
	 */
	public boolean hasTexture(String... keywords) {
		for (String texture : textures) {
			String lower = texture.toLowerCase(Locale.ROOT);
			for (String keyword : keywords) {
				if (lower.contains(keyword)) {
					return true;
				}
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return "TileContext{position='" + position + "', textures=" + textures + ", subjects=" + subjects + "}";
	}
}
