package admit.java.keys;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Transport-neutral view of an inbound request, as far as key extraction needs it.
 *
 * @param remoteAddress connection peer, host part only ("" if unknown)
 * @param path logical request path
 * @param headers header values; names are matched case-insensitively
 * @param clientId identity set by an upstream authentication step ("" if none ran)
 */
public record AdmissionRequest(
    String remoteAddress,
    String path,
    Map<String, String> headers,
    String clientId
) {
    public AdmissionRequest {
        remoteAddress = remoteAddress == null ? "" : remoteAddress;
        path = path == null ? "" : path;
        clientId = clientId == null ? "" : clientId;

        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
        }
        headers = Collections.unmodifiableMap(normalized);
    }

    public static AdmissionRequest of(String remoteAddress, String path) {
        return new AdmissionRequest(remoteAddress, path, Map.of(), "");
    }

    /**
     * @return the header value, or "" if the header is absent
     */
    public String header(String name) {
        String value = headers.get(name.toLowerCase(Locale.ROOT));
        return value == null ? "" : value;
    }

    public AdmissionRequest withHeader(String name, String value) {
        Map<String, String> copy = new HashMap<>(headers);
        copy.put(name.toLowerCase(Locale.ROOT), value);
        return new AdmissionRequest(remoteAddress, path, copy, clientId);
    }

    public AdmissionRequest withClientId(String id) {
        return new AdmissionRequest(remoteAddress, path, headers, id);
    }
}
