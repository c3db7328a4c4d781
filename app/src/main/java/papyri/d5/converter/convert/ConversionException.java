package papyri.d5.converter.convert;

/**
 * Raised when a whole document cannot be converted, e.g. because its source cannot be read.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
