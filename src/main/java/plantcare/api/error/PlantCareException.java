package plantcare.api.error;

import org.springframework.http.HttpStatus;

/**
 * Base class for errors the API reports with a specific status and error code.
 *
 * <p>Mapped to the JSON error envelope by {@link ApiExceptionHandler}.
 */
public class PlantCareException extends RuntimeException {
    private final HttpStatus status;
    private final String errorCode;

    public PlantCareException(HttpStatus status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
