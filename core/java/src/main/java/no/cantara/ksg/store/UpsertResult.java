package no.cantara.ksg.store;

/**
 * Outcome of a single store write. Stores report failure here instead of throwing.
 *
 * @param status  {@code "success"} or {@code "error"}
 * @param uuid    uuid of the written entity
 * @param message failure detail, {@code null} on success
 */
public record UpsertResult(String status, String uuid, String message) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static UpsertResult success(String uuid) {
        return new UpsertResult(SUCCESS, uuid, null);
    }

    public static UpsertResult error(String uuid, String message) {
        return new UpsertResult(ERROR, uuid, message);
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
