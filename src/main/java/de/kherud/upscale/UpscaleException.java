package de.kherud.upscale;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure of an upscale request.
 *
 * Every failure carries an {@link ErrorKind} so callers can map it to a structured error
 * response without parsing messages.
 */
public class UpscaleException extends RuntimeException {

	public enum ErrorKind {
		/** Non-positive tile size, overlap not smaller than the tile size, non-finite scale. */
		INVALID_PARAMETER("invalid_parameter"),
		/** Unreadable image or zero width/height. */
		INVALID_IMAGE("invalid_image"),
		/** Decomposition would exceed the configured tile limit. */
		TILE_LIMIT_EXCEEDED("tile_limit_exceeded"),
		/** The enhancement capability failed for at least one tile. */
		ENHANCEMENT_FAILED("enhancement_failed"),
		/** A capability call exceeded its deadline. */
		TIMED_OUT("timed_out");

		private final String code;

		ErrorKind(String code) {
			this.code = code;
		}

		public String getCode() {
			return code;
		}
	}

	private final ErrorKind kind;

	public UpscaleException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public UpscaleException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * Structured error body for API responses.
	 *
	 * @return map with {@code kind} and {@code message} entries
	 */
	public Map<String, String> toErrorBody() {
		Map<String, String> body = new LinkedHashMap<>();
		body.put("kind", kind.getCode());
		body.put("message", getMessage());
		return body;
	}
}
