package org.labsuite.codonlib;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import org.junit.Before;
import org.junit.Test;

/**
 * A test for {@link LibraryDesignTool}.
 * @author dmyersturnbull
 */
public class LibraryDesignToolTest {

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private int run(String... args) throws UnsupportedEncodingException {
		return LibraryDesignTool.run(args, new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
	}

	private String out() throws UnsupportedEncodingException {
		return out.toString("UTF-8");
	}

	private String err() throws UnsupportedEncodingException {
		return err.toString("UTF-8");
	}

	@Test
	public void testNoArguments() throws UnsupportedEncodingException {
		assertEquals(2, run());
		assertTrue(err().startsWith("Usage: LibraryDesignTool"));
		assertEquals("", out());
	}

	@Test
	public void testUnknownCommand() throws UnsupportedEncodingException {
		assertEquals(2, run("mutate", "NNK"));
		assertTrue(err().contains("synthesize AMINO_ACIDS"));
	}

	@Test
	public void testCommandWithoutOperand() throws UnsupportedEncodingException {
		assertEquals(2, run("analyze"));
		assertTrue(err().startsWith("Usage:"));
	}

	@Test
	public void testAnalyze() throws UnsupportedEncodingException {
		assertEquals(0, run("analyze", "NNK", "NNK"));
		String report = out();
		assertTrue(report.contains("Degenerate codon: NNK"));
		assertTrue(report.contains("Possible codons: 32 | Unique amino acids: 21"));
		assertTrue(report.contains("Total positions: 2"));
		assertTrue(report.contains("Library size: 1.02e+3 variants"));
		assertTrue(report.contains("Positions with stop codons: 2"));
		assertTrue(report.contains("* " + LibraryScale.COMPLETE_SCREENING.getRecommendation()));
		assertEquals("", err());
	}

	@Test
	public void testAnalyzeInvalidCode() throws UnsupportedEncodingException {
		assertEquals(1, run("analyze", "NXK"));
		String message = err().trim();
		assertEquals("Error: Invalid IUPAC code: X", message);
		assertFalse(message.contains("\n"));
		assertEquals("", out());
	}

	@Test
	public void testSynthesizeBalanced() throws UnsupportedEncodingException {
		assertEquals(0, run("synthesize", "AG", "balanced"));
		String report = out();
		assertTrue(report.contains("balanced"));
		assertTrue(report.contains("Target: AG"));
		assertTrue(report.contains("Widened to: AGILMFPWV"));
		assertTrue(report.contains("GSA: 2 codons"));
		assertEquals("", err());
	}

	@Test
	public void testSynthesizeDefaultsToMinimal() throws UnsupportedEncodingException {
		assertEquals(0, run("synthesize", "AG"));
		assertTrue(out().contains("GSA: 2 codons"));
		assertFalse(out().contains("Widened to"));
	}

	@Test
	public void testSynthesizeUnknownStrategy() throws UnsupportedEncodingException {
		assertEquals(1, run("synthesize", "AG", "greedy"));
		assertTrue(err().startsWith("Error: Unknown strategy \"greedy\""));
	}

	@Test
	public void testSynthesizeEmptyTarget() throws UnsupportedEncodingException {
		assertEquals(1, run("synthesize", "*"));
		assertTrue(err().startsWith("Error: No valid amino acids"));
	}

}
