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

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

/** Conversion between {@link PixImage} and ImageJ's RGB {@link ColorProcessor}. */
public final class PixImageConverter
{
	private PixImageConverter() {}

	/**
	 * Reads the packed RGB values of a {@link ColorProcessor}. Any other processor is read
	 * as grayscale through {@link ImageProcessor#convertToByteProcessor()}, which scales
	 * 16-bit and float images to their display range.
	 */
	static public PixImage toPixImage(final ImageProcessor ip) {
		final int width = ip.getWidth();
		final int height = ip.getHeight();
		final PixImage image = new PixImage(width, height);
		if (ip instanceof ColorProcessor) {
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					final int rgb = ip.getPixel(x, y);
					image.setPixel(x, y,
							(short)((rgb >> 16) & 0xff),
							(short)((rgb >> 8) & 0xff),
							(short)(rgb & 0xff));
				}
			}
		} else {
			final ImageProcessor bp = ip.convertToByteProcessor();
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					final short v = (short)bp.get(x, y);
					image.setPixel(x, y, v, v, v);
				}
			}
		}
		return image;
	}

	static public ColorProcessor toColorProcessor(final PixImage image) {
		final ColorProcessor cp = new ColorProcessor(image.getWidth(), image.getHeight());
		for (int y = 0; y < image.getHeight(); y++) {
			for (int x = 0; x < image.getWidth(); x++) {
				cp.putPixel(x, y, (image.getRed(x, y) << 16) | (image.getGreen(x, y) << 8) | image.getBlue(x, y));
			}
		}
		return cp;
	}
}
