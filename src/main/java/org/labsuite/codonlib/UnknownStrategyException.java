package org.labsuite.codonlib;

/**
 * A strategy name that is not one of {@link SynthesisStrategy}.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class UnknownStrategyException extends LibraryDesignException {

	public UnknownStrategyException(String name) {
		super("Unknown strategy \"" + name + "\"; expected minimal, all or balanced");
	}

}
