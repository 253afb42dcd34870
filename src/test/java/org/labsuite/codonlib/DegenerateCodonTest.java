package org.labsuite.codonlib;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * A test for {@link DegenerateCodon}.
 * @author dmyersturnbull
 */
@RunWith(Parameterized.class)
public class DegenerateCodonTest {

	private final String codon;
	private final int expectedSize;

	public DegenerateCodonTest(String codon, int expectedSize) {
		this.codon = codon;
		this.expectedSize = expectedSize;
	}

	@Test
	public void testExpansionSize() throws LibraryDesignException {
		DegenerateCodon parsed = DegenerateCodon.parse(codon);
		List<Codon> codons = parsed.expand();
		assertEquals("Wrong size for " + codon, expectedSize, parsed.size());
		assertEquals("Wrong expansion size for " + codon, expectedSize, codons.size());
		assertEquals("Repeated codons for " + codon, expectedSize, new HashSet<>(codons).size());
	}

	@Test
	public void testExpansionMatchesCodes() throws LibraryDesignException {
		DegenerateCodon parsed = DegenerateCodon.parse(codon);
		for (Codon c : parsed.expand()) {
			for (int i = 0; i < 3; i++) {
				assertTrue(c + " does not match " + codon, parsed.getCode(i).getBases().contains(c.getBase(i)));
			}
		}
	}

	@Test
	public void testRoundTrip() throws LibraryDesignException {
		assertEquals(codon.toUpperCase(), DegenerateCodon.parse(codon).toString());
	}

	@Parameters
	public static Collection<Object[]> getInstances() {
		List<Object[]> list = new ArrayList<>();
		list.add(new Object[] {"ATG", 1});
		list.add(new Object[] {"NNK", 32});
		list.add(new Object[] {"nns", 32});
		list.add(new Object[] {"NNN", 64});
		list.add(new Object[] {"NNM", 32});
		list.add(new Object[] {"GCN", 4});
		list.add(new Object[] {"RYB", 12});
		list.add(new Object[] {"DHV", 27});
		list.add(new Object[] {"WSk", 8});
		return list;
	}

}
