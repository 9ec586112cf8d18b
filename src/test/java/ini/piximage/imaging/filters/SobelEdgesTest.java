/*-
 * #%L
 * PixImage filters for ImageJ.
 * %%
 * Copyright (C) 2005 - 2025 Albert Cardona, Stephan Saalfeld and others.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package ini.piximage.imaging.filters;

import static org.junit.Assert.*;

import ini.piximage.imaging.PixImage;

import java.util.Collections;
import java.util.Random;

import org.junit.Test;

public class SobelEdgesTest {

	@Test
	public void edges3x3() {
		final PixImage image = PixImage.fromGrayscale(BoxBlurTest.IMAGE_3x3);
		assertEquals(PixImage.fromGrayscale(new int[][]{
				{104, 189, 180},
				{160, 193, 157},
				{166, 178, 96}}), image.sobelEdges());
	}

	@Test
	public void edges2x3() {
		final PixImage image = PixImage.fromGrayscale(BoxBlurTest.IMAGE_2x3);
		assertEquals(PixImage.fromGrayscale(new int[][]{
				{122, 143, 74},
				{74, 143, 122}}), image.sobelEdges());
	}

	@Test
	public void uniformImageHasNoEdges() {
		final PixImage image = new PixImage(4, 3);
		for (int y = 0; y < 3; y++) {
			for (int x = 0; x < 4; x++) {
				image.setPixel(x, y, (short)200, (short)13, (short)90);
			}
		}
		assertEquals(new PixImage(4, 3), image.sobelEdges());
	}

	@Test
	public void singlePixelHasNoEdges() {
		final PixImage image = PixImage.fromGrayscale(new int[][]{{7}});
		assertEquals(new PixImage(1, 1), image.sobelEdges());
	}

	@Test
	public void outputIsGrayAndInRange() {
		final PixImage image = BoxBlurTest.randomImage(new Random(5), 9, 8);
		final PixImage edges = image.sobelEdges();
		assertEquals(9, edges.getWidth());
		assertEquals(8, edges.getHeight());
		for (int y = 0; y < 8; y++) {
			for (int x = 0; x < 9; x++) {
				final short v = edges.getRed(x, y);
				assertTrue(v >= 0 && v <= 255);
				assertEquals(v, edges.getGreen(x, y));
				assertEquals(v, edges.getBlue(x, y));
			}
		}
	}

	@Test
	public void inputIsNotModified() {
		final PixImage image = PixImage.fromGrayscale(BoxBlurTest.IMAGE_3x3);
		final PixImage copy = image.copy();
		image.sobelEdges();
		assertEquals(copy, image);
	}

	@Test
	public void gradientsOfOneChannelIgnoreTheOthers() {
		final PixImage image = BoxBlurTest.randomImage(new Random(9), 5, 5);
		final PixImage changed = image.copy();
		changed.setPixel(2, 2, (short)((image.getRed(2, 2) + 100) % 256), image.getGreen(2, 2), image.getBlue(2, 2));

		final long[] gx1 = new long[3], gy1 = new long[3], gx2 = new long[3], gy2 = new long[3];
		for (int y = 0; y < 5; y++) {
			for (int x = 0; x < 5; x++) {
				SobelEdges.gradients(image, x, y, gx1, gy1);
				SobelEdges.gradients(changed, x, y, gx2, gy2);
				assertEquals(gx1[PixImage.GREEN], gx2[PixImage.GREEN]);
				assertEquals(gy1[PixImage.GREEN], gy2[PixImage.GREEN]);
				assertEquals(gx1[PixImage.BLUE], gx2[PixImage.BLUE]);
				assertEquals(gy1[PixImage.BLUE], gy2[PixImage.BLUE]);
			}
		}
	}

	@Test
	public void channelsContributeSymmetrically() {
		// the same values in a single channel give the same edges, whichever the channel
		final int[][] values = {{0, 50, 200}, {10, 255, 30}, {90, 90, 0}, {5, 60, 120}};
		final PixImage red = new PixImage(4, 3), green = new PixImage(4, 3);
		for (int x = 0; x < 4; x++) {
			for (int y = 0; y < 3; y++) {
				final short v = (short)values[x][y];
				red.setPixel(x, y, v, (short)0, (short)0);
				green.setPixel(x, y, (short)0, v, (short)0);
			}
		}
		assertEquals(red.sobelEdges(), green.sobelEdges());
	}

	@Test
	public void mag2gray() {
		assertEquals(0, SobelEdges.mag2gray(0));
		assertEquals(0, SobelEdges.mag2gray(5080));
		assertEquals(158, SobelEdges.mag2gray(1000000));
		assertEquals(254, SobelEdges.mag2gray(24969600));
		assertEquals(255, SobelEdges.mag2gray(1000000000000L));
	}

	@Test
	public void parallelEqualsSequential() {
		final PixImage image = BoxBlurTest.randomImage(new Random(13), 40, 17);
		assertEquals(SobelEdges.sobelEdges(image), SobelEdges.sobelEdges(image, 3));
		assertEquals(image.sobelEdges(), new SobelEdges(2).process(image));
	}

	@Test
	public void parameters() {
		assertEquals(new SobelEdges(), new SobelEdges(Collections.<String,String>emptyMap()));
		assertEquals(new SobelEdges(1), new SobelEdges(Collections.singletonMap("threads", "1")));
		assertEquals("<pix_filter class=\"ini.piximage.imaging.filters.SobelEdges\" threads=\"1\" />\n", new SobelEdges().toXML(""));
	}

	@Test
	public void requestedThreadsAreKept() {
		final SobelEdges many = new SobelEdges(16);
		assertEquals(16, many.getThreads());
		assertNotEquals(new SobelEdges(6), many);
		assertEquals(many, new SobelEdges(Collections.singletonMap("threads", "16")));
		assertEquals("<pix_filter class=\"ini.piximage.imaging.filters.SobelEdges\" threads=\"16\" />\n", many.toXML(""));
		final PixImage image = BoxBlurTest.randomImage(new Random(3), 12, 25);
		assertEquals(image.sobelEdges(), many.process(image));
	}

	@Test(expected = IllegalArgumentException.class)
	public void badParametersAreRejected() {
		new SobelEdges(Collections.singletonMap("threads", "many"));
	}
}
