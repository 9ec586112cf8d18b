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
package ini.piximage.utils;

import java.io.CharArrayWriter;
import java.io.PrintWriter;

/** Prints the stack trace of an error, and of all its causes, to the log. */
public class IJError {

	private IJError() {}

	static public final void print(Throwable e) {
		final StringBuilder sb = new StringBuilder("==================\nERROR:\n");
		while (null != e) {
			final CharArrayWriter caw = new CharArrayWriter();
			final PrintWriter pw = new PrintWriter(caw);
			e.printStackTrace(pw);
			pw.flush();
			sb.append(fixNewLines(caw.toString()));

			final Throwable t = e.getCause();
			if (e == t || null == t) break;
			sb.append("==> Caused by:\n");
			e = t;
		}
		sb.append("==================\n");
		Utils.log(sb.toString());
	}

	/** Converts carriage returns to line feeds. */
	static final String fixNewLines(final String s) {
		final char[] chars = s.toCharArray();
		for (int i=0; i<chars.length; i++) {
			if (chars[i]=='\r') chars[i] = '\n';
		}
		return new String(chars);
	}
}
