package filament;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class FilamentOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static FilamentOptions parse(String... args) throws FilamentOptionException {
		FilamentOptions opts = new FilamentOptions(args);
		opts.parse();
		return opts;
	}

	private String config(String json) throws IOException {
		File file = folder.newFile("filament.json");
		FileUtils.writeStringToFile(file, json, StandardCharsets.UTF_8);
		return file.getPath();
	}

	@Test
	public void testDefaults() throws FilamentOptionException {
		FilamentOptions opts = parse("top.fil");
		assertThat(opts.inputFilePath, is("top.fil"));
		assertThat(opts.main, is("main"));
		assertThat(opts.solver, is("builtin"));
		assertTrue(opts.jobs >= 1);
		assertThat(opts.entryArguments.isEmpty(), is(true));
		assertThat(opts.libraryPaths.isEmpty(), is(true));
	}

	@Test
	public void testEntryArguments() throws FilamentOptionException {
		FilamentOptions opts = parse("-m", "Mul", "--args=32, 3", "top.fil");
		assertThat(opts.main, is("Mul"));
		assertThat(opts.entryArguments, is(Arrays.asList(32L, 3L)));
	}

	@Test(expected = FilamentOptionException.class)
	public void testNonLiteralArgument() throws FilamentOptionException {
		parse("--args=W", "top.fil");
	}

	@Test(expected = FilamentOptionException.class)
	public void testUnknownFlag() throws FilamentOptionException {
		parse("--bogus", "top.fil");
	}

	@Test
	public void testMaxDepth() throws FilamentOptionException {
		assertThat(parse("top.fil").maxDepth, is(256));
		assertThat(parse("--max-depth=8", "top.fil").maxDepth, is(8));
	}

	@Test(expected = FilamentOptionException.class)
	public void testNonPositiveMaxDepth() throws FilamentOptionException {
		parse("--max-depth=0", "top.fil");
	}

	@Test(expected = FilamentOptionException.class)
	public void testUnknownSolver() throws FilamentOptionException {
		parse("--solver=yices", "top.fil");
	}

	@Test(expected = FilamentOptionException.class)
	public void testMissingSource() throws FilamentOptionException {
		parse("-c");
	}

	@Test(expected = FilamentOptionException.class)
	public void testTwoSources() throws FilamentOptionException {
		parse("a.fil", "b.fil");
	}

	@Test
	public void testInformationalNeedsNoSource() throws FilamentOptionException {
		assertThat(parse("--version").isInformational(), is(true));
	}

	@Test
	public void testConfigurationFile() throws IOException, FilamentOptionException {
		String path = config("{\"solver\": \"z3\", \"main\": \"top\", \"jobs\": 3, \"show_models\": true, " +
				"\"library_paths\": [\"lib\"]}");
		FilamentOptions opts = parse("--config=" + path, "-L", "a:b", "top.fil");
		assertThat(opts.solver, is("z3"));
		assertThat(opts.main, is("top"));
		assertThat(opts.jobs, is(3));
		assertThat(opts.showModels, is(true));
		// command line directories are searched first
		assertThat(opts.libraryPaths, is(Arrays.asList("a", "b", "lib")));
	}

	@Test
	public void testCommandLineOverridesConfiguration() throws IOException, FilamentOptionException {
		String path = config("{\"solver\": \"z3\", \"main\": \"top\"}");
		FilamentOptions opts = parse("--config=" + path, "--solver=cvc5", "-m", "other", "top.fil");
		assertThat(opts.solver, is("cvc5"));
		assertThat(opts.main, is("other"));
		assertThat(opts.libraryPaths, is(Collections.<String>emptyList()));
	}

	@Test(expected = FilamentOptionException.class)
	public void testMalformedConfiguration() throws IOException, FilamentOptionException {
		parse("--config=" + config("{\"solver\": "), "top.fil");
	}

	@Test(expected = FilamentOptionException.class)
	public void testMissingConfiguration() throws FilamentOptionException {
		parse("--config=" + new File(folder.getRoot(), "absent.json").getPath(), "top.fil");
	}
}
