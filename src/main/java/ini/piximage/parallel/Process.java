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
package ini.piximage.parallel;

import ini.piximage.utils.Utils;

import java.util.AbstractList;
import java.util.Collection;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/** For all methods, if the number of processors given as argument is zero or larger than the maximum available plus 2,
 *  the number of processors will be adjusted to fall within the range [1, max+2]. */
public class Process {

	static private final int MIN_AHEAD = 4;
	static public final int NUM_PROCESSORS = Runtime.getRuntime().availableProcessors();

	private Process() {}

	/** The work done for one input of {@link #progressive(Iterable, Task, Collection, int)}. */
	public interface Task<I,O> {
		O process(I input);
	}

	/** The work done for one row of {@link #rows(int, RowTask, int)}. */
	public interface RowTask {
		void run(int row);
	}

	static public final int sensible(final int nproc) {
		return Math.max(1, Math.min(nproc, NUM_PROCESSORS + 2));
	}

	/** The integers from 0 (inclusive) to n (exclusive), for iterating over rows or columns. */
	static public final List<Integer> range(final int n) {
		return new AbstractList<Integer>() {
			@Override
			public Integer get(final int i) {
				if (i < 0 || i >= n) throw new IndexOutOfBoundsException("Index: " + i + ", size: " + n);
				return i;
			}
			@Override
			public int size() {
				return Math.max(0, n);
			}
		};
	}

	/** Takes a Collection of inputs, applies the task to each,
	 *  and places their output in outputs in the same order as each input was retrieved from inputs. */
	static public final <I,O> void progressive(final Iterable<I> inputs, final Task<I,O> task, final Collection<O> outputs, final int n_proc) {
		final int nproc = sensible(n_proc);
		final ExecutorService exec = Utils.newFixedThreadPool(nproc, "Process.progressive");
		try {
			final LinkedList<Future<O>> fus = new LinkedList<Future<O>>();
			final int ahead = Math.max(nproc + nproc, MIN_AHEAD);
			for (final I input : inputs) {
				if (Thread.currentThread().isInterrupted()) {
					throw new RuntimeException("Interrupted before all tasks were submitted");
				}
				fus.add(exec.submit(new Callable<O>() {
					@Override
					public O call() {
						return task.process(input);
					}
				}));
				while (fus.size() > ahead) {
					// wait
					final O o = await(fus.removeFirst());
					if (null != outputs) outputs.add(o);
				}
			}
			// wait for remaining, if any
			for (final Future<O> fu : fus) {
				final O o = await(fu);
				if (null != outputs) outputs.add(o);
			}
		} finally {
			exec.shutdown();
		}
	}

	/** Takes a Collection of inputs, applies the task to each and discards the outputs. */
	static public final <I,O> void progressive(final Iterable<I> inputs, final Task<I,O> task, final int n_proc) {
		progressive(inputs, task, null, n_proc);
	}

	/** Runs the task once for every row from 0 to nRows (exclusive), inline when n_proc is 1 or there is a single row,
	 *  otherwise on a pool of n_proc threads. Returns when all rows are done. */
	static public final void rows(final int nRows, final RowTask task, final int n_proc) {
		if (sensible(n_proc) < 2 || nRows < 2) {
			for (int row = 0; row < nRows; row++) task.run(row);
			return;
		}
		progressive(range(nRows), new Task<Integer,Void>() {
			@Override
			public Void process(final Integer row) {
				task.run(row);
				return null;
			}
		}, n_proc);
	}

	static private final <O> O await(final Future<O> fu) {
		try {
			return fu.get();
		} catch (final InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted while waiting for a task", ie);
		} catch (final ExecutionException ee) {
			throw new RuntimeException("Task failed", ee.getCause());
		}
	}
}
