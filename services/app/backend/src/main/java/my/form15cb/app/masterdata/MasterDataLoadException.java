package my.form15cb.app.masterdata;

public class MasterDataLoadException extends RuntimeException {
	public MasterDataLoadException(String message, Throwable cause) {
		super(message, cause);
	}

	public MasterDataLoadException(String message) {
		super(message);
	}
}
