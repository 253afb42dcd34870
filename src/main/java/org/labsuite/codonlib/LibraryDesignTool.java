package org.labsuite.codonlib;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command-line front end.
 * <ul>
 * <li>{@code analyze CODON [CODON...]} calculates a library with one position per codon, and prints the amino-acid
 * distribution of each position and a summary of the library.</li>
 * <li>{@code synthesize AMINO_ACIDS [minimal|all|balanced]} prints degenerate codons for the amino acids.</li>
 * </ul>
 * @author dmyersturnbull
 */
public class LibraryDesignTool {

	private static final Logger logger = LogManager.getLogger(LibraryDesignTool.class.getName());

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Runs one command, writing reports to {@code out} and usage and error messages to {@code err}.
	 * @return The exit status: 0 on success, 1 if the input was rejected, 2 if the arguments were not understood
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {

		if (args.length < 2 || !args[0].equals("analyze") && !args[0].equals("synthesize")) {
			err.println("Usage: " + LibraryDesignTool.class.getSimpleName() + " analyze CODON [CODON...]");
			err.println("       " + LibraryDesignTool.class.getSimpleName() + " synthesize AMINO_ACIDS [minimal|all|balanced]");
			return 2;
		}

		try {
			if (args[0].equals("analyze")) {
				analyze(Arrays.asList(args).subList(1, args.length), out);
			} else {
				synthesize(args[1], args.length > 2 ? args[2] : SynthesisStrategy.MINIMAL.getLabel(), out);
			}
		} catch (LibraryDesignException e) {
			logger.debug("Request failed", e);
			err.println("Error: " + e.getMessage());
			return 1;
		}
		return 0;
	}

	private static void analyze(List<String> codons, PrintStream out) throws LibraryDesignException {

		Library library = new Library(codons);
		LibraryAnalysis analysis = library.recalculate();

		for (int i = 0; i < analysis.size(); i++) {
			Position position = analysis.getPositions().get(i);
			PositionAnalysis result = analysis.getAnalyses().get(i);
			printHeader(position.getName(), out);
			out.println("Degenerate codon: " + position.getCodon());
			out.println("Possible codons: " + result.getTotalCodons() + " | Unique amino acids: " + result.getUniqueSymbolCount());
			if (result.hasStopCodon()) {
				out.println("Stop: " + String.format("%1$.1f", result.getStopFrequency()) + "%");
			}
			out.println();
			for (AminoAcidFrequency frequency : result.getFrequencies()) {
				AminoAcid aa = frequency.getAminoAcid();
				out.println(String.format("%1$-2s %2$-14s %3$6.1f%% %4$3d/%5$-3d %6$-18s %7$-15s %8$s", aa, aa.getFullName(),
						frequency.getFrequency(), frequency.getCount(), result.getTotalCodons(), aa.getCharge(),
						aa.getPolarity(), aa.getSize()));
			}
			out.println();
			for (Map.Entry<AminoAcidProperty, Double> entry : result.getPropertyFrequencies().entrySet()) {
				out.println(String.format("%1$-9s %2$6.1f%%", entry.getKey(), entry.getValue()));
			}
		}

		printHeader("library", out);
		out.println("Total positions: " + analysis.size());
		out.println("Library size: " + analysis.getDiversity().format() + " variants");
		out.println("Positions with stop codons: " + analysis.getPositionsWithStop().size());
		DescriptiveStatistics stops = analysis.getStopFrequencyStatistics();
		out.println("Mean stop frequency: " + String.format("%1$.2f", stops.getMean()) + "% (max "
				+ String.format("%1$.2f", stops.getMax()) + "%)");
		out.println("Variants without stop codons: " + String.format("%1$.1f", analysis.getStopFreeFraction() * 100) + "%");
		out.println();
		for (String recommendation : analysis.getRecommendations()) {
			out.println("* " + recommendation);
		}
	}

	private static void synthesize(String aminoAcids, String strategy, PrintStream out) throws LibraryDesignException {

		SynthesisResult result = ReverseSynthesizer.synthesize(aminoAcids, strategy);

		printHeader(result.getStrategy().getLabel(), out);
		out.println("Target: " + result.getTarget());
		if (!result.getSearchedAminoAcids().equals(result.getTarget())) {
			out.println("Widened to: " + result.getSearchedAminoAcids());
		}
		out.println();
		for (CoverCandidate candidate : result.getCandidates()) {
			out.println(candidate);
		}
	}

	private static void printHeader(String name, PrintStream out) {
		out.println();
		out.println(repeat("-", 80));
		out.println(repeat("-", 40 - name.length()/2) + name + repeat("-", 40 - (name.length() + 1)/2));
		out.println(repeat("-", 80));
	}

	private static String repeat(String s, int x) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < x; i++) sb.append(s);
		return sb.toString();
	}

}
