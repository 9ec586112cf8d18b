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

import ij.IJ;

import java.io.PrintStream;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/** Logging and thread pool utilities shared by the filters. */
public class Utils {

	/** When true, filter chains report every applied filter through {@link #log2(String)}. */
	static public boolean debug = false;

	static private PrintStream printer = System.out;

	private Utils() {}

	static public synchronized void setLogStream(final PrintStream ps) {
		printer = null == ps ? System.out : ps;
	}

	static public synchronized PrintStream getLogStream() {
		return printer;
	}

	/** Intended for the user to see: goes to the ImageJ Log window when ImageJ is running. */
	static public final void log(final String msg) {
		if (null != IJ.getInstance()) {
			IJ.log(msg);
		} else {
			getLogStream().println(msg);
		}
	}

	/** Intended for developers: prints to terminal. */
	static public final void log2(final String msg) {
		System.out.println(msg);
	}

	/** Creates a new fixed thread pool of daemon threads named after {@code namePrefix}. */
	static public final ThreadPoolExecutor newFixedThreadPool(final int n_proc, final String namePrefix) {
		final ThreadPoolExecutor exec = (ThreadPoolExecutor) Executors.newFixedThreadPool(n_proc);
		final AtomicInteger ai = new AtomicInteger(0);
		exec.setThreadFactory(new ThreadFactory() {
			@Override
			public Thread newThread(final Runnable r) {
				final ThreadGroup tg = Thread.currentThread().getThreadGroup();
				final Thread t = new Thread(tg, r, new StringBuilder(null == namePrefix ? tg.getName() : namePrefix).append('-').append(ai.incrementAndGet()).toString());
				t.setDaemon(true);
				t.setPriority(Thread.NORM_PRIORITY);
				return t;
			}
		});
		return exec;
	}
}
