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
package roam;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import roam.core.Diagnostics;
import roam.core.OperationalSemantics;
import roam.core.Strategy;
import roam.core.Syntax.Term;
import roam.io.Lexer;
import roam.io.Parser;
import roam.io.Printer;
import roam.util.BatchReducer;
import roam.util.Pair;
import roam.util.ParseError;

/**
 * Command line front end, which parses one or more programs and reduces each
 * to normal form. Programs are given as expressions, as files, or (if neither
 * is given) on standard input.
 *
 * @author David J. Pearce
 *
 */
@Command(name = "roam", mixinStandardHelpOptions = true, version = "roam 0.1.0",
		description = "Reduce ROAM programs to normal form.")
public class Main implements Callable<Integer> {
	private static final Logger LOGGER = LogManager.getLogger(Main.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_PARSE_ERROR = 1;
	public static final int EXIT_IO_ERROR = 3;
	public static final int EXIT_BUDGET_EXHAUSTED = 4;

	@Option(names = { "-e", "--expression" }, paramLabel = "EXPR", description = "Program text to reduce.")
	List<String> expressions = new ArrayList<>();

	@Parameters(paramLabel = "FILE", description = "Files containing programs to reduce.")
	List<String> files = new ArrayList<>();

	@Option(names = "--max-steps", paramLabel = "N", description = "Maximum steps per program (0 for no limit).")
	Long maxSteps;

	@Option(names = "--strategy", paramLabel = "S", description = "Redex choice: leftmost, rightmost or random.")
	String strategy;

	@Option(names = "--seed", paramLabel = "N", description = "Seed for the random strategy.")
	Long seed;

	@Option(names = "--threads", paramLabel = "N", description = "Number of threads for reducing several programs.")
	Integer threads;

	@Option(names = "--trace", description = "Print every reduction step.")
	boolean trace;

	@Option(names = "--serialize", description = "Print results in compact canonical form.")
	boolean serialize;

	@Option(names = "--diagnose", description = "Report capabilities which can never be consumed.")
	boolean diagnose;

	@Option(names = { "-v", "--verbose" }, description = "Enable debug logging.")
	boolean verbose;

	@Spec
	CommandSpec spec;

	public static void main(String[] args) {
		System.exit(new CommandLine(new Main()).execute(args));
	}

	@Override
	public Integer call() {
		if (verbose) {
			Configurator.setRootLevel(Level.DEBUG);
		}
		PrintWriter out = spec.commandLine().getOut();
		PrintWriter err = spec.commandLine().getErr();
		long budget = maxSteps != null ? maxSteps : RoamConfig.MAX_STEPS;
		int width = threads != null ? threads : RoamConfig.THREADS;
		if (width < 1) {
			throw new CommandLine.ParameterException(spec.commandLine(), "invalid number of threads: " + width);
		}
		OperationalSemantics semantics = new OperationalSemantics(strategy());
		// Read and parse all programs
		ArrayList<Pair<String, String>> sources = new ArrayList<>();
		int exitCode = read(sources, err);
		ArrayList<Pair<String, Term>> programs = new ArrayList<>();
		for (Pair<String, String> source : sources) {
			try {
				programs.add(new Pair<>(source.first(), Parser.parse(source.second())));
			} catch (ParseError e) {
				err.print(source.first() + ": " + e.toSourceError());
				exitCode = Math.max(exitCode, EXIT_PARSE_ERROR);
			}
		}
		// Reduce them
		List<Term> results;
		try {
			results = reduce(semantics, programs, budget, width, out);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("reduction interrupted", e);
		} catch (ExecutionException e) {
			throw new IllegalStateException("reduction failed", e.getCause());
		}
		// Report results
		for (int i = 0; i != programs.size(); ++i) {
			String label = programs.get(i).first();
			Term result = results.get(i);
			out.println(serialize ? Printer.serialize(result) : Printer.toDisplay(result));
			if (budget > 0 && !semantics.isNormalForm(result)) {
				LOGGER.info("{}: step budget of {} exhausted", label, budget);
				err.println(label + ": step budget of " + budget + " exhausted before normal form");
				exitCode = Math.max(exitCode, EXIT_BUDGET_EXHAUSTED);
			}
			if (diagnose) {
				for (Pair<String, Term.Capability> p : Diagnostics.unresolved(result)) {
					String where = p.first() == null ? "top level" : "'" + p.first() + "'";
					LOGGER.info("{}: unresolved {} in {}", label, p.second(), where);
					err.println(label + ": unresolved '" + p.second() + "' in " + where);
				}
			}
		}
		out.flush();
		err.flush();
		return exitCode;
	}

	/**
	 * Read the text of every program given on the command line, labelling each
	 * with where it came from. Standard input is read when no programs are given.
	 *
	 * @return Exit code reflecting whether all inputs could be read.
	 */
	private int read(List<Pair<String, String>> sources, PrintWriter err) {
		int exitCode = EXIT_OK;
		for (int i = 0; i != expressions.size(); ++i) {
			sources.add(new Pair<>("<expr " + (i + 1) + ">", expressions.get(i)));
		}
		for (String file : files) {
			try {
				sources.add(new Pair<>(file, new Lexer(file).text()));
			} catch (IOException e) {
				LOGGER.error("cannot read {}", file, e);
				err.println(file + ": cannot read file (" + e.getMessage() + ")");
				exitCode = EXIT_IO_ERROR;
			}
		}
		if (expressions.isEmpty() && files.isEmpty()) {
			try {
				sources.add(new Pair<>("<stdin>", new Lexer(System.in).text()));
			} catch (IOException e) {
				LOGGER.error("cannot read standard input", e);
				err.println("<stdin>: cannot read input (" + e.getMessage() + ")");
				exitCode = EXIT_IO_ERROR;
			}
		}
		return exitCode;
	}

	private Strategy strategy() {
		String name = strategy != null ? strategy : RoamConfig.STRATEGY;
		long s = seed != null ? seed : RoamConfig.SEED;
		try {
			return Strategy.of(name, s);
		} catch (IllegalArgumentException e) {
			throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
		}
	}

	private List<Term> reduce(OperationalSemantics semantics, List<Pair<String, Term>> programs, long budget,
			int width, PrintWriter out) throws InterruptedException, ExecutionException {
		ArrayList<Term> terms = new ArrayList<>();
		for (Pair<String, Term> p : programs) {
			terms.add(p.second());
		}
		// The random strategy is stateful, so must run sequentially to be reproducible
		if (programs.size() > 1 && !trace && width > 1 && (semantics.getStrategy() == Strategy.LEFTMOST
				|| semantics.getStrategy() == Strategy.RIGHTMOST)) {
			BatchReducer reducer = new BatchReducer(semantics, width, budget);
			try {
				return reducer.reduceAll(terms);
			} finally {
				reducer.shutdown();
			}
		}
		ArrayList<Term> results = new ArrayList<>();
		for (Term t : terms) {
			if (trace) {
				out.println("0: " + Printer.toDisplay(t));
				results.add(semantics.execute(t, budget, (step, redex, before, after) -> out.println(
						step + " " + redex.kind().name().toLowerCase(Locale.ROOT) + ": " + Printer.toDisplay(after))));
			} else {
				results.add(semantics.execute(t, budget));
			}
		}
		return results;
	}
}
