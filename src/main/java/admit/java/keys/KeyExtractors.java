package admit.java.keys;

/**
 * Standard key extractors.
 *
 * <p>Granularity, coarsest first:
 * <ul>
 *   <li>{@link #global()}: one bucket for all traffic</li>
 *   <li>{@link #byPath()}: one bucket per endpoint, shared by all clients</li>
 *   <li>{@link #byClientAddress()} / {@link #byClientId()}: one bucket per client</li>
 *   <li>{@link #byClientAddressAndPath()} / {@link #byClientIdAndPath()}: one bucket per client per endpoint</li>
 * </ul>
 *
 * <p>Address-based keys use the first (client-most) hop of {@value #FORWARDED_FOR}, not the
 * whole header value, and the connection address without its port. A verbatim header key
 * would give one client a new bucket for every proxy chain it arrives through, and the
 * ephemeral port would give it a new bucket per connection.
 *
 * <p>Address-based keys trust {@value #FORWARDED_FOR}. Behind a proxy that does not overwrite it,
 * clients can pick their own key; only use them behind a trusted proxy or with direct connections.
 */
public final class KeyExtractors {

    public static final String GLOBAL_KEY = "global";
    public static final String FORWARDED_FOR = "X-Forwarded-For";

    private static final KeyExtractor GLOBAL = request -> GLOBAL_KEY;
    private static final KeyExtractor BY_CLIENT_ADDRESS = KeyExtractors::clientAddress;
    private static final KeyExtractor BY_PATH = AdmissionRequest::path;
    private static final KeyExtractor BY_CLIENT_ADDRESS_AND_PATH =
        request -> clientAddress(request) + ":" + request.path();
    private static final KeyExtractor BY_CLIENT_ID = AdmissionRequest::clientId;
    private static final KeyExtractor BY_CLIENT_ID_AND_PATH =
        request -> request.clientId() + ":" + request.path();

    private KeyExtractors() {
        // Utility class, no instantiation
    }

    public static KeyExtractor global() {
        return GLOBAL;
    }

    /**
     * First hop of X-Forwarded-For when present, otherwise the connection address.
     */
    public static KeyExtractor byClientAddress() {
        return BY_CLIENT_ADDRESS;
    }

    public static KeyExtractor byPath() {
        return BY_PATH;
    }

    public static KeyExtractor byClientAddressAndPath() {
        return BY_CLIENT_ADDRESS_AND_PATH;
    }

    /**
     * Identity established upstream. Returns "" when authentication has not run,
     * so all unauthenticated requests share one bucket.
     */
    public static KeyExtractor byClientId() {
        return BY_CLIENT_ID;
    }

    public static KeyExtractor byClientIdAndPath() {
        return BY_CLIENT_ID_AND_PATH;
    }

    /**
     * Header value verbatim, "" when absent.
     */
    public static KeyExtractor byHeader(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name must not be blank");
        }
        return request -> request.header(name);
    }

    static String clientAddress(AdmissionRequest request) {
        String forwarded = request.header(FORWARDED_FOR);
        if (!forwarded.isEmpty()) {
            int comma = forwarded.indexOf(',');
            String first = (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.remoteAddress();
    }
}
