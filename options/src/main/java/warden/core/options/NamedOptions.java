package warden.core.options;

/**
 * Constants shared by named options configurers and the options registry.
 */
public final class NamedOptions {

    /**
     * Name used for the default (unnamed) options instance.
     */
    public static final String DEFAULT_NAME = "";

    private NamedOptions() {}
}
