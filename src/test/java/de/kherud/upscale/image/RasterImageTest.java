package de.kherud.upscale.image;

import de.kherud.upscale.TestImages;
import de.kherud.upscale.UpscaleException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Test for RasterImage functionality.
 */
public class RasterImageTest {

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	@Test
	public void testWrapValidation() {
		try {
			RasterImage.wrap(2, 2, new byte[15]);
			fail("Buffer size mismatch must be rejected");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("mismatch"));
		}
		try {
			RasterImage.blank(0, 5);
			fail("Zero width must be rejected");
		} catch (UpscaleException e) {
			assertEquals(UpscaleException.ErrorKind.INVALID_IMAGE, e.getKind());
		}
	}

	@Test
	public void testPngRoundTripKeepsAlpha() throws Exception {
		RasterImage image = TestImages.gradient(13, 7);
		image.set(3, 3, 3, 40);

		File file = tempFolder.newFile("roundtrip.png");
		image.write(file.toPath());
		RasterImage loaded = RasterImage.read(file.toPath());

		assertArrayEquals(image.getPixels(), loaded.getPixels());
		assertArrayEquals(image.getPixels(), RasterImage.decode(image.toPng()).getPixels());
	}

	@Test
	public void testJpegIsWrittenOpaque() throws Exception {
		File file = new File(tempFolder.getRoot(), "out.jpg");
		TestImages.gradient(16, 16).write(file.toPath());

		RasterImage loaded = RasterImage.read(file.toPath());
		assertEquals(16, loaded.getWidth());
		assertEquals(255, loaded.get(5, 5, 3));
	}

	@Test
	public void testUnreadableData() throws Exception {
		try {
			RasterImage.decode("definitely not an image".getBytes());
			fail("Garbage must be rejected");
		} catch (UpscaleException e) {
			assertEquals(UpscaleException.ErrorKind.INVALID_IMAGE, e.getKind());
		}

		File file = tempFolder.newFile("broken.png");
		Files.write(file.toPath(), new byte[]{1, 2, 3});
		try {
			RasterImage.read(file.toPath());
			fail("Broken file must be rejected");
		} catch (UpscaleException e) {
			assertEquals(UpscaleException.ErrorKind.INVALID_IMAGE, e.getKind());
		}
	}

	@Test
	public void testCrop() {
		RasterImage image = TestImages.gradient(20, 10);
		RasterImage crop = image.crop(5, 2, 4, 3);

		assertEquals(4, crop.getWidth());
		assertEquals(3, crop.getHeight());
		for (int c = 0; c < RasterImage.CHANNELS; c++) {
			assertEquals(image.get(5, 2, c), crop.get(0, 0, c));
			assertEquals(image.get(8, 4, c), crop.get(3, 2, c));
		}

		try {
			image.crop(18, 0, 4, 4);
			fail("Crop outside bounds must be rejected");
		} catch (IllegalArgumentException expected) {
			// out of bounds
		}
	}

	@Test
	public void testResizeAndCopy() {
		RasterImage image = TestImages.gradient(10, 6);
		RasterImage resized = image.resize(25, 15);
		assertEquals(25, resized.getWidth());
		assertEquals(15, resized.getHeight());

		RasterImage copy = image.copy();
		copy.set(0, 0, 0, 99);
		assertEquals("Copy must not share the buffer", 0, image.get(0, 0, 0));

		RasterImage same = image.resize(10, 6);
		assertArrayEquals(image.getPixels(), same.getPixels());
	}
}
