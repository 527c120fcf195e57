package my.form15cb.app.xml;

public class XmlParseException extends RuntimeException {
	public XmlParseException(String message, Throwable cause) {
		super(message, cause);
	}

	public XmlParseException(String message) {
		super(message);
	}
}
