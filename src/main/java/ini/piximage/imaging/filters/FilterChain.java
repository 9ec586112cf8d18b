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

import ij.process.ImageProcessor;
import ini.piximage.imaging.PixImage;
import ini.piximage.imaging.PixImageConverter;
import ini.piximage.utils.IJError;
import ini.piximage.utils.Utils;

/** Applies arrays of {@link IFilter}, in order, to an image. */
public final class FilterChain
{
	private FilterChain() {}

	/** Each filter reads the output of the previous one. A null or empty array returns the image itself. */
	static public PixImage apply(final PixImage image, final IFilter[] filters) {
		PixImage result = image;
		if (null == filters) return result;
		for (final IFilter filter : filters) {
			result = filter.process(result);
			if (Utils.debug) Utils.log2("Applied " + filter.getClass().getSimpleName() + " to " + result.getWidth() + "x" + result.getHeight() + " image");
		}
		return result;
	}

	/**
	 * Applies the filters to the RGB content of an ImageJ processor.
	 * Returns a new ColorProcessor, or the given processor if there are no filters
	 * or if any filter failed, in which case the error is logged.
	 */
	static public ImageProcessor apply(final ImageProcessor ip, final IFilter[] filters) {
		if (null == filters || 0 == filters.length) return ip;
		try {
			final PixImage result = apply(PixImageConverter.toPixImage(ip), filters);
			return PixImageConverter.toColorProcessor(result);
		} catch (final Exception e) {
			Utils.log("ERROR: could not apply " + filters.length + " filters to " + ip);
			IJError.print(e);
			return ip;
		}
	}
}
