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

import ini.piximage.imaging.PixImage;
import ini.piximage.parallel.Process;

import java.util.Map;

/**
 * Sobel edge detection. Computes separate gradients for the red, green and blue
 * components at each pixel, sums the squares of all six gradients into an energy,
 * and maps the energy to a grayscale intensity with {@link #mag2gray(long)}.
 * Whiter pixels represent stronger edges.
 *
 * Near the boundary, neighbors outside of the image are replaced by the nearest
 * pixel of the image, that is, the boundary row or column is repeated.
 *
 * See http://en.wikipedia.org/wiki/Sobel_operator#Formulation
 */
public class SobelEdges implements IFilter
{
	/** Indexed as [dx + 1][dy + 1]. */
	static final int[][] GX = {
		{1, 0, -1},
		{2, 0, -2},
		{1, 0, -1}
	};

	static final int[][] GY = {
		{ 1,  2,  1},
		{ 0,  0,  0},
		{-1, -2, -1}
	};

	protected int threads = 1;

	public SobelEdges() {}

	/** @param threads The number of threads computing rows, kept as requested and reduced to what the machine offers when filtering. */
	public SobelEdges(final int threads) {
		this.threads = threads;
	}

	public SobelEdges(final Map<String,String> params) {
		try {
			final String t = params.get("threads");
			this.threads = null == t ? 1 : Integer.parseInt(t);
		} catch (final NumberFormatException nfe) {
			throw new IllegalArgumentException("Could not create SobelEdges filter!", nfe);
		}
	}

	public int getThreads() {
		return threads;
	}

	@Override
	public PixImage process(final PixImage image) {
		return sobelEdges(image, threads);
	}

	/** Returns a new grayscale image of the same dimensions, leaving the given one untouched. */
	static public PixImage sobelEdges(final PixImage image) {
		return sobelEdges(image, 1);
	}

	static public PixImage sobelEdges(final PixImage image, final int threads) {
		final PixImage edges = new PixImage(image.getWidth(), image.getHeight());
		Process.rows(image.getHeight(), new Process.RowTask() {
			@Override
			public void run(final int y) {
				edgeRow(image, edges, y);
			}
		}, threads);
		return edges;
	}

	static private void edgeRow(final PixImage src, final PixImage dst, final int y) {
		final long[] gx = new long[3];
		final long[] gy = new long[3];
		for (int x = 0; x < src.getWidth(); x++) {
			gradients(src, x, y, gx, gy);
			final long energy = gx[0] * gx[0] + gy[0] * gy[0]
			                  + gx[1] * gx[1] + gy[1] * gy[1]
			                  + gx[2] * gx[2] + gy[2] * gy[2];
			final short gray = mag2gray(energy);
			dst.setPixel(x, y, gray, gray, gray);
		}
	}

	/** Fills gx and gy with the per-channel gradients at (x, y). */
	static void gradients(final PixImage src, final int x, final int y, final long[] gx, final long[] gy) {
		final int lastx = src.getWidth() - 1;
		final int lasty = src.getHeight() - 1;
		for (int c = 0; c < 3; c++) {
			gx[c] = 0;
			gy[c] = 0;
		}
		for (int dx = -1; dx <= 1; dx++) {
			final int i = Math.max(0, Math.min(lastx, x + dx));
			for (int dy = -1; dy <= 1; dy++) {
				final int j = Math.max(0, Math.min(lasty, y + dy));
				final int wx = GX[dx + 1][dy + 1];
				final int wy = GY[dx + 1][dy + 1];
				for (int c = 0; c < 3; c++) {
					final short v = src.get(i, j, c);
					gx[c] += wx * v;
					gy[c] += wy * v;
				}
			}
		}
	}

	/**
	 * Maps an energy (squared vector magnitude) in the range 0...24,969,600
	 * to a grayscale intensity in the range 0...255. The map is logarithmic,
	 * but shifted so that values of 5,080 and below map to zero.
	 */
	static public short mag2gray(final long mag) {
		// the cast truncates toward zero
		final int intensity = (int)(30.0 * Math.log(1.0 + (double)mag) - 256.0);
		if (intensity < 0) return 0;
		if (intensity > 255) return 255;
		return (short)intensity;
	}

	@Override
	public String toXML(final String indent) {
		return new StringBuilder(indent)
			.append("<pix_filter class=\"").append(getClass().getName())
			.append("\" threads=\"").append(threads)
			.append("\" />\n").toString();
	}

	@Override
	public boolean equals(final Object o) {
		return null != o && o.getClass() == SobelEdges.class && threads == ((SobelEdges)o).threads;
	}

	@Override
	public int hashCode() {
		return threads;
	}
}
