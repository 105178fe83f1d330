package de.kherud.upscale.image;

import de.kherud.upscale.UpscaleException;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Raw RGBA image buffer.
 *
 * Pixels are stored interleaved as {@code R, G, B, A} bytes, row-major, so the byte for channel
 * {@code c} of pixel {@code (x, y)} lives at {@code ((y * width) + x) * 4 + c}.
 */
public final class RasterImage {

	public static final int CHANNELS = 4;

	private final int width;
	private final int height;
	private final byte[] pixels;

	private RasterImage(int width, int height, byte[] pixels) {
		this.width = width;
		this.height = height;
		this.pixels = pixels;
	}

	/**
	 * Wrap an existing RGBA buffer. The array is not copied.
	 *
	 * @param width image width in pixels
	 * @param height image height in pixels
	 * @param pixels interleaved RGBA bytes
	 * @return image backed by {@code pixels}
	 * @throws UpscaleException with {@code INVALID_IMAGE} if the dimensions are not positive
	 * @throws IllegalArgumentException if the buffer size does not match the dimensions
	 */
	public static RasterImage wrap(int width, int height, byte[] pixels) {
		checkDimensions(width, height);
		if (pixels == null) {
			throw new IllegalArgumentException("Pixel data cannot be null");
		}
		long expectedSize = (long) width * height * CHANNELS;
		if (pixels.length != expectedSize) {
			throw new IllegalArgumentException(
				String.format("Pixel data size mismatch: expected %d bytes, got %d", expectedSize, pixels.length));
		}
		return new RasterImage(width, height, pixels);
	}

	/**
	 * Allocate a transparent black image.
	 */
	public static RasterImage blank(int width, int height) {
		checkDimensions(width, height);
		return new RasterImage(width, height, new byte[Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS)]);
	}

	public static RasterImage fromBufferedImage(BufferedImage image) {
		int w = image.getWidth();
		int h = image.getHeight();
		checkDimensions(w, h);

		int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
		byte[] data = new byte[w * h * CHANNELS];
		for (int i = 0; i < argb.length; i++) {
			int p = argb[i];
			int base = i * CHANNELS;
			data[base] = (byte) ((p >> 16) & 0xFF);
			data[base + 1] = (byte) ((p >> 8) & 0xFF);
			data[base + 2] = (byte) (p & 0xFF);
			data[base + 3] = (byte) ((p >>> 24) & 0xFF);
		}
		return new RasterImage(w, h, data);
	}

	public BufferedImage toBufferedImage() {
		BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		int[] argb = new int[width * height];
		for (int i = 0; i < argb.length; i++) {
			int base = i * CHANNELS;
			argb[i] = ((pixels[base + 3] & 0xFF) << 24)
				| ((pixels[base] & 0xFF) << 16)
				| ((pixels[base + 1] & 0xFF) << 8)
				| (pixels[base + 2] & 0xFF);
		}
		image.setRGB(0, 0, width, height, argb, 0, width);
		return image;
	}

	/**
	 * Load an image from disk.
	 *
	 * @throws IOException if the file cannot be read
	 * @throws UpscaleException with {@code INVALID_IMAGE} if the format is not recognized
	 */
	public static RasterImage read(Path path) throws IOException {
		BufferedImage image = ImageIO.read(path.toFile());
		if (image == null) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_IMAGE, "Failed to load image: " + path);
		}
		return fromBufferedImage(image);
	}

	public static RasterImage decode(byte[] encoded) throws IOException {
		BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
		if (image == null) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_IMAGE, "Unrecognized image data");
		}
		return fromBufferedImage(image);
	}

	/**
	 * Write the image, picking the format from the file extension (PNG when unknown).
	 */
	public void write(Path path) throws IOException {
		String format = formatFor(path);
		BufferedImage image = "png".equals(format) ? toBufferedImage() : toOpaqueImage();
		if (!ImageIO.write(image, format, path.toFile())) {
			throw new IOException("No image writer for format: " + format);
		}
	}

	public byte[] encode(String format) throws IOException {
		BufferedImage image = "png".equalsIgnoreCase(format) ? toBufferedImage() : toOpaqueImage();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		if (!ImageIO.write(image, format, out)) {
			throw new IOException("No image writer for format: " + format);
		}
		return out.toByteArray();
	}

	public byte[] toPng() throws IOException {
		return encode("png");
	}

	/**
	 * Copy a rectangular region into a new image.
	 *
	 * @throws IllegalArgumentException if the region is empty or leaves the image bounds
	 */
	public RasterImage crop(int x, int y, int w, int h) {
		if (w <= 0 || h <= 0 || x < 0 || y < 0 || x + w > width || y + h > height) {
			throw new IllegalArgumentException(
				String.format("Crop region %dx%d at (%d,%d) outside %dx%d image", w, h, x, y, width, height));
		}
		byte[] data = new byte[w * h * CHANNELS];
		int rowBytes = w * CHANNELS;
		for (int row = 0; row < h; row++) {
			System.arraycopy(pixels, ((y + row) * width + x) * CHANNELS, data, row * rowBytes, rowBytes);
		}
		return new RasterImage(w, h, data);
	}

	/**
	 * Resample to the given size with bicubic interpolation.
	 */
	public RasterImage resize(int newWidth, int newHeight) {
		checkDimensions(newWidth, newHeight);
		if (newWidth == width && newHeight == height) {
			return copy();
		}
		BufferedImage resized = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_ARGB);
		Graphics2D g2d = resized.createGraphics();
		g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
		g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
		g2d.drawImage(toBufferedImage(), 0, 0, newWidth, newHeight, null);
		g2d.dispose();
		return fromBufferedImage(resized);
	}

	public RasterImage copy() {
		return new RasterImage(width, height, pixels.clone());
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * Direct access to the backing RGBA buffer.
	 */
	public byte[] getPixels() {
		return pixels;
	}

	public int get(int x, int y, int channel) {
		return pixels[(y * width + x) * CHANNELS + channel] & 0xFF;
	}

	public void set(int x, int y, int channel, int value) {
		pixels[(y * width + x) * CHANNELS + channel] = (byte) value;
	}

	@Override
	public String toString() {
		return String.format("RasterImage{%dx%d}", width, height);
	}

	private BufferedImage toOpaqueImage() {
		BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = rgb.createGraphics();
		g2d.drawImage(toBufferedImage(), 0, 0, null);
		g2d.dispose();
		return rgb;
	}

	private static String formatFor(Path path) {
		String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
		int dot = name.lastIndexOf('.');
		String ext = dot >= 0 ? name.substring(dot + 1) : "";
		switch (ext) {
			case "jpg":
			case "jpeg":
				return "jpg";
			case "bmp":
				return "bmp";
			default:
				return "png";
		}
	}

	private static void checkDimensions(int width, int height) {
		if (width <= 0 || height <= 0) {
			throw new UpscaleException(UpscaleException.ErrorKind.INVALID_IMAGE,
				String.format("Image dimensions must be positive, got %dx%d", width, height));
		}
	}
}
