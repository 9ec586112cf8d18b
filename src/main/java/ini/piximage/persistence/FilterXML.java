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

import ini.piximage.imaging.filters.IFilter;
import ini.piximage.utils.IJError;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Reads and writes filter chains as XML:
 * <pre>
 * &lt;pix_filters&gt;
 *   &lt;pix_filter class="ini.piximage.imaging.filters.BoxBlur" iterations="2" /&gt;
 *   &lt;pix_filter class="ini.piximage.imaging.filters.SobelEdges" /&gt;
 * &lt;/pix_filters&gt;
 * </pre>
 * Every {@code pix_filter} is instantiated through the public constructor of its
 * class that takes a {@code Map<String,String>} of the remaining attributes.
 */
public final class FilterXML
{
	static public final String FILTERS = "pix_filters";
	static public final String FILTER = "pix_filter";

	private FilterXML() {}

	/** Note: will close the xml_stream. */
	static public IFilter[] parse(final InputStream xml_stream) {
		final FilterHandler handler = new FilterHandler();
		try {
			final SAXParserFactory factory = SAXParserFactory.newInstance();
			final SAXParser parser = factory.newSAXParser();
			parser.parse(new InputSource(xml_stream), handler);
		} catch (final SAXException e) {
			if (e.getException() instanceof IllegalArgumentException) {
				throw (IllegalArgumentException) e.getException();
			}
			throw new IllegalArgumentException("Malformed filter XML", e);
		} catch (final ParserConfigurationException e) {
			throw new IllegalStateException("Could not create an XML parser", e);
		} catch (final IOException e) {
			throw new IllegalArgumentException("Could not read filter XML", e);
		} finally {
			try {
				xml_stream.close();
			} catch (final IOException ioe) {
				IJError.print(ioe);
			}
		}
		return handler.filters.toArray(new IFilter[handler.filters.size()]);
	}

	static public IFilter[] parse(final String xml) {
		return parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
	}

	static public String toXML(final IFilter[] filters, final String indent) {
		final StringBuilder sb = new StringBuilder(indent).append('<').append(FILTERS).append(">\n");
		if (null != filters) {
			for (final IFilter f : filters) sb.append(f.toXML(indent + "\t")); // specify their own line termination
		}
		return sb.append(indent).append("</").append(FILTERS).append(">\n").toString();
	}

	static IFilter newFilter(final Map<String,String> ht_attributes) {
		final String class_name = ht_attributes.remove("class");
		if (null == class_name) {
			throw new IllegalArgumentException("Filter without a class attribute: " + ht_attributes);
		}
		final Class<?> c;
		try {
			c = Class.forName(class_name);
		} catch (final ClassNotFoundException cnfe) {
			throw new IllegalArgumentException("Unknown filter class " + class_name, cnfe);
		}
		if (!IFilter.class.isAssignableFrom(c)) {
			throw new IllegalArgumentException("Not a filter: " + class_name);
		}
		try {
			return (IFilter) c.getConstructor(Map.class).newInstance(ht_attributes);
		} catch (final java.lang.reflect.InvocationTargetException ite) {
			throw new IllegalArgumentException("Could not create filter " + class_name, ite.getCause());
		} catch (final Exception e) {
			throw new IllegalArgumentException("Could not create filter " + class_name, e);
		}
	}

	static private final class FilterHandler extends DefaultHandler
	{
		private final List<IFilter> filters = new ArrayList<IFilter>();

		@Override
		public void startElement(final String namespace_URI, final String local_name, String qualified_name, final Attributes attributes) throws SAXException {
			qualified_name = qualified_name.toLowerCase();
			if (FILTERS.equals(qualified_name)) return;
			if (!FILTER.equals(qualified_name)) {
				throw new SAXException("Unexpected element <" + qualified_name + ">");
			}
			final HashMap<String,String> ht_attributes = new HashMap<String,String>();
			for (int i=attributes.getLength() -1; i>-1; i--) {
				ht_attributes.put(attributes.getQName(i).toLowerCase(), attributes.getValue(i));
			}
			try {
				filters.add(newFilter(ht_attributes));
			} catch (final IllegalArgumentException iae) {
				throw new SAXException(iae);
			}
		}
	}
}
