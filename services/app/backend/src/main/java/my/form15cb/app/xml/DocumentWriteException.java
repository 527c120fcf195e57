package my.form15cb.app.xml;

import java.nio.file.Path;

public class DocumentWriteException extends RuntimeException {
	private final Path path;

	public DocumentWriteException(Path path, Throwable cause) {
		super("Failed to write XML document: " + path, cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}
}
