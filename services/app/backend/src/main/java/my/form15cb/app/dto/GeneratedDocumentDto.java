package my.form15cb.app.dto;

public record GeneratedDocumentDto(
		String path,
		String filename
) {
}
