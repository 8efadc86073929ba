// This file is part of the ROAM Reducer.
//
// The ROAM Reducer is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The ROAM Reducer is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the ROAM Reducer. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package roam.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import roam.core.OperationalSemantics;
import roam.core.Syntax.Term;

/**
 * Reduces many independent programs in parallel. Programs are split into
 * batches, one per thread, and the results joined back together in their
 * original order. Since terms are immutable, and the semantics holds no
 * mutable state (other than the random strategy), nothing is shared between
 * reductions.
 *
 * @author David J. Pearce
 *
 */
public class BatchReducer {
	private static final Logger LOGGER = LogManager.getLogger(BatchReducer.class);

	/**
	 * Thread pool to use for parallel processing.
	 */
	private final ExecutorService executor;

	/**
	 * Semantics used to reduce each program.
	 */
	private final OperationalSemantics semantics;

	/**
	 * Number of distinct batches to be dispatched in one go. Normally, this should
	 * not exceed the number of available threads.
	 */
	private final int nthreads;

	/**
	 * Maximum number of steps for any one program (where zero means no limit).
	 */
	private final long maxSteps;

	public BatchReducer(OperationalSemantics semantics, int nthreads, long maxSteps) {
		if (nthreads < 1) {
			throw new IllegalArgumentException("invalid dispatch width: " + nthreads);
		}
		this.semantics = semantics;
		this.nthreads = nthreads;
		this.maxSteps = maxSteps;
		this.executor = Executors.newFixedThreadPool(nthreads);
	}

	public int getDispatchWidth() {
		return nthreads;
	}

	/**
	 * Reduce a list of programs, returning their results in the same order.
	 *
	 * @param programs
	 * @return
	 * @throws InterruptedException
	 * @throws ExecutionException
	 *             if reducing any program failed.
	 */
	public List<Term> reduceAll(List<Term> programs) throws InterruptedException, ExecutionException {
		final long startTime = System.currentTimeMillis();
		int batchSize = (programs.size() + nthreads - 1) / nthreads;
		ArrayList<Future<List<Term>>> threads = new ArrayList<>();
		// Submit each batch for processing
		for (int i = 0; i < programs.size(); i += batchSize) {
			final List<Term> batch = programs.subList(i, Math.min(programs.size(), i + batchSize));
			threads.add(executor.submit(() -> reduce(batch)));
		}
		// Join all back together
		ArrayList<Term> results = new ArrayList<>();
		for (Future<List<Term>> f : threads) {
			results.addAll(f.get());
		}
		LOGGER.debug("reduced {} program(s) in {} batch(es) in {}ms", programs.size(), threads.size(),
				System.currentTimeMillis() - startTime);
		return results;
	}

	private List<Term> reduce(List<Term> batch) {
		ArrayList<Term> results = new ArrayList<>();
		for (Term t : batch) {
			results.add(semantics.execute(t, maxSteps));
		}
		return results;
	}

	/**
	 * Release the threads used by this reducer.
	 */
	public void shutdown() {
		executor.shutdown();
	}
}
