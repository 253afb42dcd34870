package org.labsuite.codonlib;

import static org.junit.Assert.*;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

/**
 * A test for {@link IupacCode}.
 * @author dmyersturnbull
 */
public class IupacCodeTest {

	@Test
	public void testEveryNonEmptySubsetHasOneCode() {
		Set<IupacCode> codes = new HashSet<>();
		for (int mask = 1; mask < 16; mask++) {
			Set<Nucleotide> bases = EnumSet.noneOf(Nucleotide.class);
			for (Nucleotide base : Nucleotide.values()) {
				if ((mask & (1 << base.ordinal())) != 0) bases.add(base);
			}
			IupacCode code = IupacCode.forBases(bases);
			assertEquals(bases, code.getBases());
			codes.add(code);
		}
		assertEquals(15, codes.size());
	}

	@Test
	public void testKnownCodes() throws InvalidCodeException {
		assertEquals(EnumSet.of(Nucleotide.G, Nucleotide.T), IupacCode.fromSymbol('K').getBases());
		assertEquals(EnumSet.of(Nucleotide.C, Nucleotide.G), IupacCode.fromSymbol('s').getBases());
		assertEquals(EnumSet.allOf(Nucleotide.class), IupacCode.fromSymbol('n').getBases());
		assertEquals(IupacCode.S, IupacCode.forBases(EnumSet.of(Nucleotide.G, Nucleotide.C)));
		assertFalse(IupacCode.A.isAmbiguous());
		assertTrue(IupacCode.B.isAmbiguous());
	}

	@Test
	public void testInvalidSymbol() {
		try {
			IupacCode.fromSymbol('x');
			fail("Expected an InvalidCodeException");
		} catch (InvalidCodeException e) {
			assertEquals('x', e.getSymbol());
			assertTrue(e.getMessage().contains("x"));
		}
	}

	@Test(expected = NoCanonicalCodeException.class)
	public void testEmptySetHasNoCode() {
		IupacCode.forBases(EnumSet.noneOf(Nucleotide.class));
	}

}
