package my.form15cb.app.xml;

public class TemplateMissingException extends RuntimeException {
	public TemplateMissingException(String message) {
		super(message);
	}
}
