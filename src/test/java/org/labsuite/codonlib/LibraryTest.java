package org.labsuite.codonlib;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;

/**
 * A test for {@link Library} and {@link LibraryAnalysis}.
 * @author dmyersturnbull
 */
public class LibraryTest {

	private static final int THREADS = 4;
	private static final int EDITS_PER_THREAD = 200;
	private static final String[] VALID_CODONS = {"NNK", "NNS", "GCN", "NNY", "TGG", "RYB"};

	@Test
	public void testDefaultLibrary() throws LibraryDesignException {
		Library library = new Library();
		assertEquals(3, library.getPositions().size());
		assertEquals("Position 1", library.getPositions().get(0).getName());
		assertEquals("NNK", library.getPositions().get(2).getCodon());
		assertNull(library.getAnalysis());
		LibraryAnalysis analysis = library.recalculate();
		assertSame(analysis, library.getAnalysis());
		assertEquals(BigInteger.valueOf(32768), analysis.getDiversity().getValue());
		assertEquals("3.28e+4", analysis.getDiversity().format());
		assertEquals(3, analysis.getPositionsWithStop().size());
	}

	@Test
	public void testDiversityIsProductOfPowers() throws LibraryDesignException {
		for (int n = 1; n <= 6; n++) {
			String[] codons = new String[n];
			Arrays.fill(codons, "NNK");
			LibraryAnalysis analysis = new Library(Arrays.asList(codons)).recalculate();
			assertEquals(BigInteger.valueOf(32).pow(n), analysis.getDiversity().getValue());
		}
	}

	@Test
	public void testRemovingLastPositionFails() throws LibraryDesignException {
		Library library = new Library(Arrays.asList("NNK"));
		Position only = library.getPositions().get(0);
		try {
			library.removePosition(only.getId());
			fail("Expected a CannotRemoveLastPositionException");
		} catch (CannotRemoveLastPositionException e) {
			// expected
		}
		assertEquals(1, library.getPositions().size());
		assertSame(only, library.getPositions().get(0));
	}

	@Test
	public void testAddAndRemove() throws LibraryDesignException {
		Library library = new Library();
		Position added = library.addPosition();
		assertEquals(4, added.getId());
		assertEquals("Position 4", added.getName());
		assertEquals(Library.DEFAULT_CODON, added.getCodon());
		assertTrue(library.removePosition(2));
		assertFalse(library.removePosition(2));
		Position another = library.addPosition("Loop", "nns");
		assertEquals(5, another.getId());
		assertEquals("NNS", another.getCodon());
		assertEquals(4, library.getPositions().size());
		assertEquals(Arrays.asList(1, 3, 4, 5), ids(library.getPositions()));
	}

	@Test
	public void testUpdatePosition() {
		Library library = new Library();
		assertTrue(library.updatePosition(2, Position.Field.CODON, "gcn"));
		assertTrue(library.updatePosition(2, Position.Field.NAME, "Active site"));
		assertFalse(library.updatePosition(42, Position.Field.NAME, "Nowhere"));
		Position updated = library.getPosition(2);
		assertEquals("GCN", updated.getCodon());
		assertEquals("Active site", updated.getName());
	}

	@Test
	public void testFailedRecalculationKeepsPreviousAnalysis() throws LibraryDesignException {
		Library library = new Library();
		LibraryAnalysis before = library.recalculate();
		library.updatePosition(1, Position.Field.CODON, "GCN");
		library.updatePosition(3, Position.Field.CODON, "NXK");
		try {
			library.recalculate();
			fail("Expected an InvalidCodeException");
		} catch (InvalidCodeException e) {
			assertEquals('X', e.getSymbol());
		}
		assertSame(before, library.getAnalysis());
		assertEquals("NNK", library.getAnalysis().getPositions().get(0).getCodon());
		assertEquals(32, library.getAnalysis().getAnalysis(1).getTotalCodons());

		library.updatePosition(3, Position.Field.CODON, "NNY");
		LibraryAnalysis after = library.recalculate();
		assertEquals(BigInteger.valueOf(4 * 32 * 32), after.getDiversity().getValue());
		assertEquals(1, after.getPositionsWithStop().size());
	}

	@Test
	public void testInvalidLengthFailsRecalculation() {
		Library library = new Library(Arrays.asList("NNK", "NK"));
		try {
			library.recalculate();
			fail("Expected an InvalidCodonLengthException");
		} catch (LibraryDesignException e) {
			assertTrue(e instanceof InvalidCodonLengthException);
		}
		assertNull(library.getAnalysis());
	}

	@Test
	public void testRecommendations() throws LibraryDesignException {
		LibraryAnalysis small = new Library(Arrays.asList("NNY", "GCN")).recalculate();
		assertEquals(LibraryScale.COMPLETE_SCREENING, small.getScale());
		assertEquals(1, small.getRecommendations().size());
		assertEquals(1.0, small.getStopFreeFraction(), 0);

		LibraryAnalysis medium = new Library(Arrays.asList("NNK", "NNK", "NNK", "NNK")).recalculate();
		assertEquals(LibraryScale.SAMPLING, medium.getScale());
		assertEquals(2, medium.getRecommendations().size());

		LibraryAnalysis large = new Library(Arrays.asList("NNN", "NNN", "NNN", "NNN", "NNN", "NNN")).recalculate();
		assertEquals(LibraryScale.TOO_LARGE, large.getScale());
	}

	@Test
	public void testStopStatistics() throws LibraryDesignException {
		LibraryAnalysis analysis = new Library(Arrays.asList("NNK", "NNY", "NNN")).recalculate();
		assertEquals((3.125 + 0 + 300.0 / 64) / 3, analysis.getStopFrequencyStatistics().getMean(), 1e-9);
		assertEquals(300.0 / 64, analysis.getStopFrequencyStatistics().getMax(), 1e-9);
		assertEquals((1 - 1.0 / 32) * (1 - 3.0 / 64), analysis.getStopFreeFraction(), 1e-9);
		assertEquals(Arrays.asList(1, 3), ids(analysis.getPositionsWithStop()));
	}

	@Test
	public void testExportRows() throws LibraryDesignException {
		Library library = new Library(Arrays.asList("NNK", "AAK"));
		library.updatePosition(2, Position.Field.NAME, "Second");
		List<ExportRow> rows = library.recalculate().getExportRows();
		assertEquals(21 + 2, rows.size());
		ExportRow last = rows.get(rows.size() - 1);
		assertEquals(2, last.getPositionNumber());
		assertEquals("Second", last.getPositionName());
		assertEquals("AAK", last.getCodon());
		assertEquals(AminoAcid.ASN, last.getAminoAcid());
		assertEquals("Asparagine", last.getAminoAcidName());
		assertEquals(50, last.getFrequency(), 0);
		assertEquals(1, last.getCount());
		assertEquals(AminoAcidProperty.POLAR, last.getProperty());
		assertEquals("polar", last.getPolarity().toString());
		assertEquals(AminoAcid.ARG, rows.get(0).getAminoAcid());
		assertEquals("slightly positive", AminoAcid.HIS.getCharge().toString());
		assertEquals("slightly polar", AminoAcid.TYR.getPolarity().toString());
	}

	@Test
	public void testCodonCaseIgnoresDefaultLocale() {
		Locale locale = Locale.getDefault();
		Locale.setDefault(new Locale("tr", "TR"));
		try {
			Library library = new Library(Arrays.asList("nni"));
			assertEquals("NNI", library.getPositions().get(0).getCodon());
		} finally {
			Locale.setDefault(locale);
		}
	}

	@Test
	public void testConcurrentEditsOnlyPublishWholeAnalyses() throws Exception {
		final Library library = new Library();
		List<Callable<Void>> tasks = new ArrayList<>(THREADS);
		for (int t = 0; t < THREADS; t++) {
			final Random random = new Random(t);
			tasks.add(new Callable<Void>() {
				@Override
				public Void call() throws Exception {
					for (int i = 0; i < EDITS_PER_THREAD; i++) {
						List<Position> positions = library.getPositions();
						assertFalse(positions.isEmpty());
						Position some = positions.get(random.nextInt(positions.size()));
						String codon = VALID_CODONS[random.nextInt(VALID_CODONS.length)];
						switch (random.nextInt(4)) {
						case 0:
							library.addPosition("Added", codon);
							break;
						case 1:
							library.updatePosition(some.getId(), Position.Field.CODON, codon);
							break;
						case 2:
							try {
								library.removePosition(some.getId());
							} catch (CannotRemoveLastPositionException e) {
								// it was the only position at the time; other threads may have added one since
								assertFalse(library.getPositions().isEmpty());
							}
							break;
						default:
							assertConsistent(library.recalculate());
						}
						LibraryAnalysis published = library.getAnalysis();
						if (published != null) assertConsistent(published);
					}
					return null;
				}
			});
		}
		ExecutorService executor = Executors.newFixedThreadPool(THREADS);
		try {
			for (Future<Void> future : executor.invokeAll(tasks)) {
				future.get(); // rethrows assertion failures from the workers
			}
		} finally {
			executor.shutdownNow();
		}
		assertFalse(library.getPositions().isEmpty());
		assertConsistent(library.recalculate());
	}

	/**
	 * Checks that {@code analysis} was calculated from one list of positions.
	 */
	private static void assertConsistent(LibraryAnalysis analysis) throws LibraryDesignException {
		assertFalse(analysis.getPositions().isEmpty());
		BigInteger product = BigInteger.ONE;
		for (Position position : analysis.getPositions()) {
			int size = DegenerateCodon.parse(position.getCodon()).size();
			assertEquals(size, analysis.getAnalysis(position.getId()).getTotalCodons());
			product = product.multiply(BigInteger.valueOf(size));
		}
		assertEquals(product, analysis.getDiversity().getValue());
	}

	private static List<Integer> ids(List<Position> positions) {
		Integer[] ids = new Integer[positions.size()];
		for (int i = 0; i < ids.length; i++) {
			ids[i] = positions.get(i).getId();
		}
		return Arrays.asList(ids);
	}

}
