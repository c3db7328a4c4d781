package papyri.d5.converter.corpus;

/**
 * Raised when the papyri.info corpus cannot be downloaded, indexed or queried.
 */
public class CorpusException extends RuntimeException {

    public CorpusException(String message) {
        super(message);
    }

    public CorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
