package admit.java.grpc;

import io.grpc.Context;

/**
 * Identity of the caller, as established by an authentication interceptor that runs
 * before {@link AdmissionInterceptor}.
 */
public final class ClientIdentity {

    /**
     * Set by the authentication step with {@code Context.current().withValue(CLIENT_ID, id)}.
     */
    public static final Context.Key<String> CLIENT_ID = Context.key("admit-client-id");

    private ClientIdentity() {
        // Utility class, no instantiation
    }

    /**
     * @return the current caller's id, or "" if no authentication step ran
     */
    public static String current() {
        String id = CLIENT_ID.get();
        return id == null ? "" : id;
    }
}
