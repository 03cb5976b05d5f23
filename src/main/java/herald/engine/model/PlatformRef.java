package herald.engine.model;

import herald.engine.error.ValidationException;

/**
 * Target of a publication: the platform name (selects the publisher) and the
 * account on that platform.
 */
public record PlatformRef(String name, String accountId) {

    public PlatformRef {
        if (name == null) {
            throw new ValidationException("platform name is required");
        }
        if (accountId == null) {
            throw new ValidationException("platform accountId is required");
        }
    }

    public static PlatformRef of(String name, String accountId) {
        return new PlatformRef(name, accountId);
    }
}
