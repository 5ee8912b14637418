package plantcare.api.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the API's error envelope: {@code {"error": {"code": ..., "message": ..., ...}}}.
 */
public final class ErrorBody {

    private ErrorBody() {
    }

    /**
     * @param extra additional fields placed next to code and message; null values are skipped
     */
    public static Map<String, Object> of(String code, String message, Map<String, ?> extra) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        extra.forEach((key, value) -> {
            if (value != null) {
                error.put(key, value);
            }
        });
        return Map.of("error", error);
    }
}
