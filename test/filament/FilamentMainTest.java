package filament;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class FilamentMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static String fixture(String name) {
		return CompilationTestingUtils.fixture(name).toString();
	}

	private static int run(String... args) {
		return new FilamentMain(args).run();
	}

	@Test
	public void testBadOptions() {
		assertThat(run("-q"), is(FilamentMain.EXIT_BAD_OPTIONS));
		assertThat(run("-q", "--solver=yices", fixture("worked_example.fil")), is(FilamentMain.EXIT_BAD_OPTIONS));
		assertThat(run("-q", "--bogus", fixture("worked_example.fil")), is(FilamentMain.EXIT_BAD_OPTIONS));
	}

	@Test
	public void testGrowingInstantiationFails() {
		assertThat(run("-q", "--max-depth=16", fixture("growing_instantiation.fil")), is(FilamentMain.EXIT_FAILURE));
	}

	@Test
	public void testCheckOnly() {
		assertThat(run("-q", "-c", fixture("worked_example.fil")), is(FilamentMain.EXIT_OK));
	}

	@Test
	public void testTypeError() {
		assertThat(run("-q", "-c", fixture("reuse_hazard.fil")), is(FilamentMain.EXIT_FAILURE));
	}

	@Test
	public void testSpecializationError() {
		assertThat(run("-q", fixture("instantiation_cycle.fil")), is(FilamentMain.EXIT_FAILURE));
	}

	@Test
	public void testJsonOutput() throws IOException {
		File output = new File(folder.getRoot(), "out.json");
		assertThat(run("-q", "-j", "2", "-o", output.getPath(), fixture("worked_example.fil")),
				is(FilamentMain.EXIT_OK));
		JSONObject json = new JSONObject(FileUtils.readFileToString(output, StandardCharsets.UTF_8));
		assertThat(json.getString("entry"), is("main"));
		assertThat(json.getJSONArray("components").length(), is(3));
	}

	@Test
	public void testSourceOutputFromAnotherEntry() throws IOException {
		File output = new File(folder.getRoot(), "out.fil");
		assertThat(run("-q", "--emit-source", "-m", "Mul", "--args=16,4", "-o", output.getPath(),
				fixture("worked_example.fil")), is(FilamentMain.EXIT_OK));
		String source = FileUtils.readFileToString(output, StandardCharsets.UTF_8);
		assertTrue(source.startsWith("extern comp Mul_16_4<G: 16>"));
	}

	@Test
	public void testReplayOptionAccepted() {
		File replay = new File(folder.getRoot(), "replay.smt2");
		assertThat(run("-q", "-c", "--solver-replay-file=" + replay.getPath(), fixture("worked_example.fil")),
				is(FilamentMain.EXIT_OK));
	}
}
