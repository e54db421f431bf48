package filament.trans.passes.load;

import filament.CompilationTestingUtils;
import filament.errors.TopLevelIssueContext;
import filament.model.ast.FilUnit;
import filament.trans.passes.parse.ParseIssue;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class LoadingPassTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private TopLevelIssueContext ctx;

	@Before
	public void setUp() {
		ctx = new TopLevelIssueContext();
	}

	private File write(String name, String contents) throws IOException {
		File file = new File(folder.getRoot(), name);
		FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void testImportsComeFirst() {
		List<FilUnit> units = CompilationTestingUtils.load(ctx, "worked_example.fil");
		assertThat(ctx.hasErrors(), is(false));
		assertThat(units.size(), is(2));
		assertThat(units.get(0).getPath().getFileName().toString(), is("mul.fil"));
		assertThat(units.get(1).getPath().getFileName().toString(), is("worked_example.fil"));
	}

	@Test
	public void testSharedImportLoadedOnce() throws IOException {
		String mul = FileUtils.readFileToString(CompilationTestingUtils.fixture("mul.fil").toFile(),
				StandardCharsets.UTF_8);
		write("mul.fil", mul);
		write("left.fil", "import \"mul.fil\";\n");
		write("right.fil", "import \"mul.fil\";\n");
		File top = write("top.fil", "import \"left.fil\";\nimport \"right.fil\";\n");
		List<FilUnit> units = LoadingPass.perform(ctx, new ModuleLoader(Collections.emptyList()), top.toPath());
		assertThat(ctx.hasErrors(), is(false));
		assertThat(units.size(), is(4));
		assertThat(units.get(0).getPath().getFileName().toString(), is("mul.fil"));
	}

	@Test
	public void testCyclicImport() {
		CompilationTestingUtils.load(ctx, Paths.get("imports", "a.fil").toString());
		List<CyclicImportIssue> cycles = CompilationTestingUtils.issuesOf(ctx, CyclicImportIssue.class);
		assertThat(cycles.size(), is(1));
		List<Path> chain = cycles.get(0).getChain();
		assertThat(chain.size(), is(3));
		assertThat(chain.get(0).getFileName().toString(), is("a.fil"));
		assertThat(chain.get(1).getFileName().toString(), is("b.fil"));
		assertThat(chain.get(2), is(chain.get(0)));
	}

	@Test
	public void testModuleNotFound() throws IOException {
		File top = write("top.fil", "import \"missing.fil\";\n");
		ModuleLoader loader = new ModuleLoader(Collections.singletonList(folder.getRoot().toPath().resolve("lib")));
		LoadingPass.perform(ctx, loader, top.toPath());
		List<ModuleNotFoundIssue> missing = CompilationTestingUtils.issuesOf(ctx, ModuleNotFoundIssue.class);
		assertThat(missing.size(), is(1));
		assertThat(missing.get(0).getImport().getPath(), is("missing.fil"));
		// next to the importing file, then the library directory
		assertThat(missing.get(0).getSearched().size(), is(2));
	}

	@Test
	public void testLibraryPath() throws IOException {
		File top = write("top.fil", "import \"mul.fil\";\n");
		Path library = CompilationTestingUtils.fixture("mul.fil").toAbsolutePath().getParent();
		List<FilUnit> units = LoadingPass.perform(ctx, new ModuleLoader(Collections.singletonList(library)),
				top.toPath());
		assertThat(ctx.hasErrors(), is(false));
		assertThat(units.size(), is(2));
		assertThat(units.get(0).getComponents().get(0).getName().getId(), is("Mul"));
	}

	@Test
	public void testMissingEntry() {
		LoadingPass.perform(ctx, new ModuleLoader(Collections.emptyList()),
				folder.getRoot().toPath().resolve("nothing.fil"));
		assertThat(CompilationTestingUtils.issuesOf(ctx, IOErrorIssue.class).size(), is(1));
	}

	@Test
	public void testParseErrorsAreReported() throws IOException {
		File top = write("top.fil", "comp main<G: 1>(go: interface[G]) -> ();\n");
		List<FilUnit> units = LoadingPass.perform(ctx, new ModuleLoader(Collections.emptyList()), top.toPath());
		assertThat(units.isEmpty(), is(true));
		assertThat(CompilationTestingUtils.issuesOf(ctx, ParseIssue.class).size(), is(1));
	}
}
