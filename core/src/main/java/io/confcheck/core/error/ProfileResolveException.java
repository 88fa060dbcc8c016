package io.confcheck.core.error;

/** Thrown when a requested profile is not defined in the configuration's {@code profiles} map. */
public final class ProfileResolveException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String profileName;

    public ProfileResolveException(String who, String profileName, Object... irritants) {
        super(Kind.ERROR, who, "Profile '" + profileName + "' not found", irritants);
        this.profileName = profileName;
    }

    /** The requested profile that could not be found. */
    public String profileName() {
        return profileName;
    }
}
