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
package ini.piximage.persistence;

import static org.junit.Assert.*;

import ini.piximage.imaging.PixImage;
import ini.piximage.imaging.filters.BoxBlur;
import ini.piximage.imaging.filters.FilterChain;
import ini.piximage.imaging.filters.IFilter;
import ini.piximage.imaging.filters.SobelEdges;

import ini.piximage.utils.Utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

public class FilterXMLTest {

	@Test
	public void parsesFiltersInDocumentOrder() {
		final InputStream in = getClass().getResourceAsStream("filters.xml");
		assertNotNull(in);
		final IFilter[] filters = FilterXML.parse(in);
		assertArrayEquals(new IFilter[]{new BoxBlur(2), new SobelEdges()}, filters);

		final PixImage image = PixImage.fromGrayscale(new int[][]{{0, 10, 240}, {30, 120, 250}, {80, 250, 255}});
		assertEquals(image.boxBlur(2).sobelEdges(), FilterChain.apply(image, filters));
	}

	@Test
	public void failingCloseKeepsParsedFilters() {
		final ByteArrayOutputStream log = new ByteArrayOutputStream();
		Utils.setLogStream(new PrintStream(log, true));
		try {
			final byte[] xml = "<pix_filters><pix_filter class=\"ini.piximage.imaging.filters.SobelEdges\" /></pix_filters>".getBytes(StandardCharsets.UTF_8);
			final InputStream in = new ByteArrayInputStream(xml) {
				@Override
				public void close() throws IOException {
					throw new IOException("disk gone");
				}
			};
			assertArrayEquals(new IFilter[]{new SobelEdges()}, FilterXML.parse(in));
			assertTrue(log.toString(), log.toString().contains("disk gone"));
		} finally {
			Utils.setLogStream(null);
		}
	}

	@Test
	public void failingCloseKeepsParsingError() {
		final ByteArrayOutputStream log = new ByteArrayOutputStream();
		Utils.setLogStream(new PrintStream(log, true));
		try {
			final InputStream in = new ByteArrayInputStream("<pix_filters><pix_filter class=".getBytes(StandardCharsets.UTF_8)) {
				@Override
				public void close() throws IOException {
					throw new IOException("disk gone");
				}
			};
			FilterXML.parse(in);
			fail("Expected an IllegalArgumentException");
		} catch (final IllegalArgumentException iae) {
			assertEquals("Malformed filter XML", iae.getMessage());
		} finally {
			Utils.setLogStream(null);
		}
	}

	@Test
	public void roundTrip() {
		final IFilter[] filters = {new SobelEdges(), new BoxBlur(3), new BoxBlur(0)};
		final String xml = FilterXML.toXML(filters, "");
		assertTrue(xml, xml.startsWith("<pix_filters>\n\t<pix_filter "));
		assertArrayEquals(filters, FilterXML.parse(xml));
	}

	@Test
	public void emptyChain() {
		assertEquals(0, FilterXML.parse("<pix_filters></pix_filters>").length);
		assertEquals("<pix_filters>\n</pix_filters>\n", FilterXML.toXML(null, ""));
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownClassIsRejected() {
		FilterXML.parse("<pix_filters><pix_filter class=\"no.such.Filter\" /></pix_filters>");
	}

	@Test(expected = IllegalArgumentException.class)
	public void nonFilterClassIsRejected() {
		FilterXML.parse("<pix_filters><pix_filter class=\"java.lang.String\" /></pix_filters>");
	}

	@Test(expected = IllegalArgumentException.class)
	public void missingClassIsRejected() {
		FilterXML.parse("<pix_filters><pix_filter iterations=\"1\" /></pix_filters>");
	}

	@Test
	public void badParameterKeepsCause() {
		try {
			FilterXML.parse("<pix_filters><pix_filter class=\"ini.piximage.imaging.filters.BoxBlur\" iterations=\"x\" /></pix_filters>");
			fail("Expected an IllegalArgumentException");
		} catch (final IllegalArgumentException iae) {
			Throwable t = iae;
			boolean found = false;
			while (null != t) {
				found |= t instanceof NumberFormatException;
				t = t.getCause();
			}
			assertTrue("NumberFormatException should be in the cause chain", found);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void malformedXmlIsRejected() {
		FilterXML.parse("<pix_filters><pix_filter class=");
	}

	@Test(expected = IllegalArgumentException.class)
	public void unexpectedElementIsRejected() {
		FilterXML.parse("<pix_filters><t2_patch /></pix_filters>");
	}
}
