package tech.yump.vaultclient.secrets;

import java.util.Map;

/**
 * A secret resolved by the service.
 *
 * @param data    Fields of the secret as returned by its engine (e.g. username/password, access_key/secret_key).
 * @param lease   Lease the secret was issued under.
 * @param request Request that produced it.
 */
public record Secret(
        Map<String, Object> data,
        Lease lease,
        SecretRequest request
) {

    public Secret {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    /**
     * Same secret, same value, extended lease.
     */
    public Secret withLease(Lease renewed) {
        return new Secret(data, renewed, request);
    }

    public String requireField(String field) {
        Object value = data.get(field);
        if (value == null) {
            throw new SecretServiceException("Secret " + request.describe() + " has no field '" + field + "'");
        }
        return value.toString();
    }

    public String optionalField(String field) {
        Object value = data.get(field);
        return value == null ? null : value.toString();
    }

    // Records print their components; keep secret material out of logs.
    @Override
    public String toString() {
        return "Secret[request=" + request.describe() + ", lease=" + lease + ", fields=" + data.keySet() + "]";
    }
}
