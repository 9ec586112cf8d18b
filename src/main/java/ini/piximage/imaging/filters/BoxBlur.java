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
 * Box blur: every pixel is replaced by the average of its neighbors,
 * INCLUDING the pixel itself.
 *
 * A pixel not on the image boundary has nine neighbors, the pixel itself and
 * the eight pixels surrounding it. A pixel on the boundary has six neighbors
 * if it is not a corner pixel, and only four if it is a corner pixel.
 * The average is the sum of the neighbor values divided by the number of
 * neighbors, rounded toward zero. Each channel is blurred separately.
 */
public class BoxBlur implements IFilter
{
	protected int iterations = 1;
	protected int threads = 1;

	public BoxBlur() {}

	public BoxBlur(final int iterations) {
		this(iterations, 1);
	}

	/**
	 * @param iterations The number of repeated blur passes; zero or negative leaves images untouched.
	 * @param threads The number of threads computing the rows of each pass, as requested;
	 *                it is reduced to what the machine offers only when blurring.
	 */
	public BoxBlur(final int iterations, final int threads) {
		this.iterations = iterations;
		this.threads = threads;
	}

	public BoxBlur(final Map<String,String> params) {
		try {
			this.iterations = Integer.parseInt(params.get("iterations"));
			final String t = params.get("threads");
			this.threads = null == t ? 1 : Integer.parseInt(t);
		} catch (final NumberFormatException nfe) {
			throw new IllegalArgumentException("Could not create BoxBlur filter!", nfe);
		}
	}

	public int getIterations() {
		return iterations;
	}

	public int getThreads() {
		return threads;
	}

	@Override
	public PixImage process(final PixImage image) {
		return boxBlur(image, iterations, threads);
	}

	/**
	 * Returns a blurred version of the image after {@code numIterations} passes,
	 * each pass reading the output of the previous one.
	 * If numIterations is zero or negative, the same image is returned (not a copy);
	 * otherwise the returned image is a new one.
	 */
	static public PixImage boxBlur(final PixImage image, final int numIterations) {
		return boxBlur(image, numIterations, 1);
	}

	static public PixImage boxBlur(final PixImage image, final int numIterations, final int threads) {
		PixImage prev = image;
		for (int i = 0; i < numIterations; i++) {
			prev = pass(prev, threads);
		}
		return prev;
	}

	/** One full blur pass over every pixel, into a new image. */
	static private PixImage pass(final PixImage src, final int threads) {
		final PixImage dst = new PixImage(src.getWidth(), src.getHeight());
		Process.rows(src.getHeight(), new Process.RowTask() {
			@Override
			public void run(final int y) {
				blurRow(src, dst, y);
			}
		}, threads);
		return dst;
	}

	static private void blurRow(final PixImage src, final PixImage dst, final int y) {
		final int width = src.getWidth();
		final int height = src.getHeight();
		final int starty = y - 1 >= 0 ? y - 1 : y;
		final int endy = y + 1 < height ? y + 1 : y;
		for (int x = 0; x < width; x++) {
			final int startx = x - 1 >= 0 ? x - 1 : x;
			final int endx = x + 1 < width ? x + 1 : x;
			int red = 0, green = 0, blue = 0;
			for (int j = starty; j <= endy; j++) {
				for (int i = startx; i <= endx; i++) {
					red += src.getRed(i, j);
					green += src.getGreen(i, j);
					blue += src.getBlue(i, j);
				}
			}
			final int count = (endx - startx + 1) * (endy - starty + 1);
			// integer division truncates toward zero
			dst.setPixel(x, y, (short)(red / count), (short)(green / count), (short)(blue / count));
		}
	}

	@Override
	public String toXML(final String indent) {
		return new StringBuilder(indent)
			.append("<pix_filter class=\"").append(getClass().getName())
			.append("\" iterations=\"").append(iterations)
			.append("\" threads=\"").append(threads)
			.append("\" />\n").toString();
	}

	@Override
	public boolean equals(final Object o) {
		if (null == o) return false;
		if (o.getClass() == BoxBlur.class) {
			final BoxBlur b = (BoxBlur)o;
			return iterations == b.iterations && threads == b.threads;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return 31 * iterations + threads;
	}
}
