package filament.model.ast;

import filament.util.SourceLocation;

import java.nio.file.Path;
import java.util.List;

/**
 * AST node:
 *
 * import "a.fil"; ... comp A ...; comp B ...
 *
 * One parsed source file.
 */
public class FilUnit extends FilNode {
	private final Path path;
	private final List<FilImport> imports;
	private final List<FilComponent> components;

	public FilUnit(SourceLocation location, Path path, List<FilImport> imports, List<FilComponent> components) {
		super(location);
		this.path = path;
		this.imports = imports;
		this.components = components;
	}

	public Path getPath() {
		return path;
	}

	public List<FilImport> getImports() {
		return imports;
	}

	public List<FilComponent> getComponents() {
		return components;
	}
}
