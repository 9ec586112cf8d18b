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
package ini.piximage.imaging;

import ini.piximage.imaging.filters.BoxBlur;
import ini.piximage.imaging.filters.SobelEdges;

import java.util.Arrays;

/**
 * A rectangular grid of color pixels. Each pixel has red, green and blue
 * intensities in the range 0...255.
 *
 * Pixels are stored in a single flat array, three consecutive entries per
 * pixel, with pixel (x, y) at offset 3 * (x + width * y).
 */
public class PixImage
{
	static public final int RED = 0, GREEN = 1, BLUE = 2;

	static public final short MIN_INTENSITY = 0;
	static public final short MAX_INTENSITY = 255;

	/** Largest array length the JVM reliably allocates. */
	static private final int MAX_LENGTH = Integer.MAX_VALUE - 8;

	private final int width;
	private final int height;
	private final short[] data;

	/**
	 * Constructs a black image of the given dimensions.
	 *
	 * @param width the width of the image, zero or larger.
	 * @param height the height of the image, zero or larger.
	 * @throws IllegalArgumentException if either dimension is negative, or if
	 *         the 3 * width * height intensities do not fit in a single array.
	 */
	public PixImage(final int width, final int height) {
		if (width < 0 || height < 0) {
			throw new IllegalArgumentException("Invalid image dimensions: " + width + "x" + height);
		}
		final long length = 3L * width * height;
		if (length > MAX_LENGTH) {
			throw new IllegalArgumentException("Image too large: " + width + "x" + height + " needs " + length + " intensities");
		}
		this.width = width;
		this.height = height;
		this.data = new short[(int) length];
	}

	/**
	 * Converts a 2D array of grayscale intensities, indexed as {@code pixels[x][y]},
	 * into an image whose red, green and blue intensities are all equal to the input.
	 * Intensities outside 0...255 leave the corresponding pixel black.
	 */
	static public PixImage fromGrayscale(final int[][] pixels) {
		final int width = pixels.length;
		final int height = 0 == width ? 0 : pixels[0].length;
		final PixImage image = new PixImage(width, height);
		for (int x = 0; x < width; x++) {
			for (int y = 0; y < height; y++) {
				final short v = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, pixels[x][y]));
				image.setPixel(x, y, v, v, v);
			}
		}
		return image;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/** The offset of the red intensity of pixel (x, y) in the data array. */
	private int getPos(final int x, final int y) {
		if (x < 0 || x >= width || y < 0 || y >= height) {
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside of " + width + "x" + height + " image");
		}
		return 3 * (x + width * y);
	}

	public short getRed(final int x, final int y) {
		return data[getPos(x, y) + RED];
	}

	public short getGreen(final int x, final int y) {
		return data[getPos(x, y) + GREEN];
	}

	public short getBlue(final int x, final int y) {
		return data[getPos(x, y) + BLUE];
	}

	/** @param channel one of {@link #RED}, {@link #GREEN} or {@link #BLUE}. */
	public short get(final int x, final int y, final int channel) {
		if (channel < RED || channel > BLUE) {
			throw new IndexOutOfBoundsException("No such channel: " + channel);
		}
		return data[getPos(x, y) + channel];
	}

	/**
	 * Sets the pixel at (x, y) to the given intensities.
	 * If any of the three intensities is not in the range 0...255,
	 * none of the pixel intensities is changed.
	 *
	 * @throws IndexOutOfBoundsException if (x, y) is outside of the image.
	 */
	public void setPixel(final int x, final int y, final short red, final short green, final short blue) {
		final int pos = getPos(x, y);
		if (!inRange(red) || !inRange(green) || !inRange(blue)) {
			return;
		}
		data[pos + RED] = red;
		data[pos + GREEN] = green;
		data[pos + BLUE] = blue;
	}

	static private boolean inRange(final short v) {
		return v >= MIN_INTENSITY && v <= MAX_INTENSITY;
	}

	public PixImage copy() {
		final PixImage c = new PixImage(width, height);
		System.arraycopy(data, 0, c.data, 0, data.length);
		return c;
	}

	/**
	 * Returns a blurred version of this image, see {@link BoxBlur#boxBlur(PixImage, int)}.
	 * If numIterations is zero or negative, this same instance is returned.
	 */
	public PixImage boxBlur(final int numIterations) {
		return BoxBlur.boxBlur(this, numIterations);
	}

	/** Returns a grayscale image of the edges of this image, see {@link SobelEdges#sobelEdges(PixImage)}. */
	public PixImage sobelEdges() {
		return SobelEdges.sobelEdges(this);
	}

	/** One line per pixel as red:green:blue, rows first. */
	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder();
		for (int i = 0; i < data.length; i += 3) {
			sb.append(data[i + RED]).append(':')
			  .append(data[i + GREEN]).append(':')
			  .append(data[i + BLUE]).append('\n');
		}
		return sb.toString();
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (null == o || o.getClass() != PixImage.class) return false;
		final PixImage p = (PixImage)o;
		return width == p.width && height == p.height && Arrays.equals(data, p.data);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * width + height) + Arrays.hashCode(data);
	}
}
