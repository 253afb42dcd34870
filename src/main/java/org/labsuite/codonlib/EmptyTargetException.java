package org.labsuite.codonlib;

/**
 * A target for reverse synthesis that contains no standard amino acid.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class EmptyTargetException extends LibraryDesignException {

	public EmptyTargetException(String input) {
		super("No valid amino acids in \"" + input + "\"; use one-letter codes such as ACDEFGHIKLMNPQRSTVWY");
	}

}
