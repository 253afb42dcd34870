package org.labsuite.codonlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An ordered, never empty list of {@link Position positions} that together make a combinatorial library.
 * <p>
 * Every edit replaces the whole position list, and {@link #recalculate()} only replaces the last analysis once every
 * position has been analyzed, so no caller ever sees a half-updated library or a mix of old and new results.
 * If any position holds an invalid codon, recalculation fails and the previous analysis stays in place.
 * @author dmyersturnbull
 */
public class Library {

	public static final String DEFAULT_CODON = "NNK";

	private static final int DEFAULT_SIZE = 3;

	private static final Logger logger = LogManager.getLogger(Library.class.getName());

	private volatile List<Position> positions;

	private volatile LibraryAnalysis analysis;

	/**
	 * Creates a library of 3 {@code NNK} positions.
	 */
	public Library() {
		List<Position> list = new ArrayList<>(DEFAULT_SIZE);
		for (int i = 1; i <= DEFAULT_SIZE; i++) {
			list.add(new Position(i, defaultName(i), DEFAULT_CODON));
		}
		positions = Collections.unmodifiableList(list);
	}

	/**
	 * Creates a library of the given codons, named {@code Position 1}, {@code Position 2}, and so on.
	 */
	public Library(List<String> codons) {
		if (codons.isEmpty()) throw new IllegalArgumentException("A library needs at least one position");
		List<Position> list = new ArrayList<>(codons.size());
		for (int i = 1; i <= codons.size(); i++) {
			list.add(new Position(i, defaultName(i), codons.get(i - 1)));
		}
		positions = Collections.unmodifiableList(list);
	}

	private static String defaultName(int number) {
		return "Position " + number;
	}

	public List<Position> getPositions() {
		return positions;
	}

	public Position getPosition(int id) {
		for (Position position : positions) {
			if (position.getId() == id) return position;
		}
		return null;
	}

	/**
	 * Returns the analysis of the last successful {@link #recalculate()}, or null if there has been none.
	 * It may be out of date with respect to the current positions.
	 */
	public LibraryAnalysis getAnalysis() {
		return analysis;
	}

	/**
	 * Appends a position named after its place in the library, with codon {@link #DEFAULT_CODON}.
	 */
	public synchronized Position addPosition() {
		return addPosition(defaultName(positions.size() + 1), DEFAULT_CODON);
	}

	public synchronized Position addPosition(String name, String codon) {
		int maxId = 0;
		for (Position position : positions) {
			maxId = Math.max(maxId, position.getId());
		}
		Position added = new Position(maxId + 1, name, codon);
		List<Position> list = new ArrayList<>(positions);
		list.add(added);
		positions = Collections.unmodifiableList(list);
		logger.debug("Added " + added);
		return added;
	}

	/**
	 * Removes the position with {@code id}.
	 * @return Whether a position was removed; false if there was none with that id
	 * @throws CannotRemoveLastPositionException If it is the only position; the library is left unchanged
	 */
	public synchronized boolean removePosition(int id) throws CannotRemoveLastPositionException {
		Position position = getPosition(id);
		if (position == null) return false;
		if (positions.size() == 1) {
			logger.debug("Refusing to remove the last position " + position);
			throw new CannotRemoveLastPositionException(position);
		}
		List<Position> list = new ArrayList<>(positions);
		list.remove(position);
		positions = Collections.unmodifiableList(list);
		logger.debug("Removed " + position);
		return true;
	}

	/**
	 * Sets one field of the position with {@code id}. Codons are upper-cased but not validated until
	 * {@link #recalculate()}.
	 * @return Whether a position was changed; false if there was none with that id
	 */
	public synchronized boolean updatePosition(int id, Position.Field field, String value) {
		List<Position> list = new ArrayList<>(positions);
		for (int i = 0; i < list.size(); i++) {
			if (list.get(i).getId() == id) {
				list.set(i, list.get(i).with(field, value));
				positions = Collections.unmodifiableList(list);
				return true;
			}
		}
		return false;
	}

	/**
	 * Analyzes every position and, if all of them are valid, makes the result the library's analysis.
	 * @throws LibraryDesignException For the first invalid position; the previous analysis is kept
	 */
	public synchronized LibraryAnalysis recalculate() throws LibraryDesignException {
		List<Position> snapshot = positions;
		List<Pair<Position, PositionAnalysis>> results = new ArrayList<>(snapshot.size());
		for (Position position : snapshot) {
			try {
				results.add(new Pair<>(position, PositionAnalyzer.analyze(position.getCodon())));
			} catch (LibraryDesignException e) {
				logger.warn("Not recalculating library: " + position.getName() + " is invalid: " + e.getMessage());
				throw e;
			}
		}
		LibraryAnalysis calculated = new LibraryAnalysis(results);
		analysis = calculated;
		logger.info("Calculated library of " + snapshot.size() + " positions with " + calculated.getDiversity() + " variants");
		return calculated;
	}

}
