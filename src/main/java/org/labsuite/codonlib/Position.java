package org.labsuite.codonlib;

import java.util.Locale;

/**
 * A named slot of a {@link Library}. The codon is kept as the user typed it (upper-cased) and only validated when the
 * library is recalculated.
 * Positions are immutable; editing a position replaces it in its library.
 * @author dmyersturnbull
 */
public class Position {

	/**
	 * The editable fields of a position.
	 */
	public enum Field {
		NAME, CODON
	}

	private final int id;
	private final String name;
	private final String codon;

	public Position(int id, String name, String codon) {
		this.id = id;
		this.name = name;
		this.codon = codon == null ? "" : codon.toUpperCase(Locale.ROOT);
	}

	public int getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public String getCodon() {
		return codon;
	}

	Position with(Field field, String value) {
		switch (field) {
		case NAME:
			return new Position(id, value, codon);
		case CODON:
			return new Position(id, name, value);
		default:
			throw new IllegalArgumentException("Unknown field " + field);
		}
	}

	@Override
	public String toString() {
		return "#" + id + " " + name + " (" + codon + ")";
	}

}
