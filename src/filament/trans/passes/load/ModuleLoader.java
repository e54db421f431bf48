package filament.trans.passes.load;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds and reads source files. An import is looked up next to the importing file first, then in each library
 * directory in order.
 */
public class ModuleLoader {
	private final List<Path> libraryPaths;

	public ModuleLoader(List<Path> libraryPaths) {
		this.libraryPaths = new ArrayList<>(libraryPaths);
	}

	public List<Path> candidates(Path importingFile, String importPath) {
		String normalized = FilenameUtils.separatorsToSystem(importPath);
		List<Path> candidates = new ArrayList<>();
		Path directory = importingFile.toAbsolutePath().getParent();
		if (directory != null) {
			candidates.add(directory.resolve(normalized).normalize());
		}
		for (Path library : libraryPaths) {
			candidates.add(library.toAbsolutePath().resolve(normalized).normalize());
		}
		return candidates;
	}

	public Optional<Path> resolve(Path importingFile, String importPath) {
		for (Path candidate : candidates(importingFile, importPath)) {
			if (Files.isRegularFile(candidate)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}

	public String read(Path file) throws IOException {
		return FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
	}
}
