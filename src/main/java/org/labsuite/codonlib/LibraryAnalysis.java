package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.util.Pair;

/**
 * The calculated state of a whole {@link Library}: one {@link PositionAnalysis} per position, in library order.
 * Instances are only built from a fully valid set of positions.
 * @author dmyersturnbull
 */
public class LibraryAnalysis {

	private static final String STOP_RECOMMENDATION = "Some positions contain stop codons - consider using NNK/NNS instead of NNN";

	private final List<Pair<Position, PositionAnalysis>> results;
	private final LibraryDiversity diversity;

	LibraryAnalysis(List<Pair<Position, PositionAnalysis>> results) {
		this.results = Collections.unmodifiableList(new ArrayList<>(results));
		List<PositionAnalysis> analyses = new ArrayList<>(results.size());
		for (Pair<Position, PositionAnalysis> result : results) {
			analyses.add(result.getSecond());
		}
		this.diversity = LibraryDiversity.of(analyses);
	}

	public List<Position> getPositions() {
		List<Position> positions = new ArrayList<>(results.size());
		for (Pair<Position, PositionAnalysis> result : results) {
			positions.add(result.getFirst());
		}
		return positions;
	}

	public List<PositionAnalysis> getAnalyses() {
		List<PositionAnalysis> analyses = new ArrayList<>(results.size());
		for (Pair<Position, PositionAnalysis> result : results) {
			analyses.add(result.getSecond());
		}
		return analyses;
	}

	/**
	 * Returns the analysis of the position with {@code id}, or null if the library had no such position when calculated.
	 */
	public PositionAnalysis getAnalysis(int id) {
		for (Pair<Position, PositionAnalysis> result : results) {
			if (result.getFirst().getId() == id) return result.getSecond();
		}
		return null;
	}

	public int size() {
		return results.size();
	}

	/**
	 * Returns the total number of variants: the product of the codon counts of all positions.
	 */
	public LibraryDiversity getDiversity() {
		return diversity;
	}

	public List<Position> getPositionsWithStop() {
		List<Position> positions = new ArrayList<>();
		for (Pair<Position, PositionAnalysis> result : results) {
			if (result.getSecond().hasStopCodon()) positions.add(result.getFirst());
		}
		return positions;
	}

	/**
	 * Returns statistics of the stop-codon percentage over the positions.
	 */
	public DescriptiveStatistics getStopFrequencyStatistics() {
		DescriptiveStatistics stats = new DescriptiveStatistics();
		for (Pair<Position, PositionAnalysis> result : results) {
			stats.addValue(result.getSecond().getStopFrequency());
		}
		return stats;
	}

	/**
	 * Returns the fraction (0 to 1) of library members expected to have no stop codon at any position.
	 */
	public double getStopFreeFraction() {
		double fraction = 1;
		for (Pair<Position, PositionAnalysis> result : results) {
			fraction *= 1 - result.getSecond().getStopFrequency() / 100;
		}
		return fraction;
	}

	public LibraryScale getScale() {
		return LibraryScale.of(diversity);
	}

	public List<String> getRecommendations() {
		List<String> recommendations = new ArrayList<>();
		recommendations.add(getScale().getRecommendation());
		if (!getPositionsWithStop().isEmpty()) recommendations.add(STOP_RECOMMENDATION);
		return recommendations;
	}

	/**
	 * Flattens the analysis into one row per amino acid per position, positions in library order and amino acids
	 * highest frequency first.
	 */
	public List<ExportRow> getExportRows() {
		List<ExportRow> rows = new ArrayList<>();
		for (int i = 0; i < results.size(); i++) {
			Pair<Position, PositionAnalysis> result = results.get(i);
			for (AminoAcidFrequency frequency : result.getSecond().getFrequencies()) {
				rows.add(new ExportRow(i + 1, result.getFirst(), frequency));
			}
		}
		return rows;
	}

}
