package warden.core.options;

/**
 * Configures a named options instance in place.
 *
 * <p>Implementations receive a freshly created options object and mutate it.
 * They must not retain the instance or hold state shared between names, since
 * the registry may call them concurrently for different names.
 *
 * @param <T> the options type
 */
public interface ConfigureNamedOptions<T> {

    /**
     * Configure the options instance registered under {@code name}.
     *
     * @param name    the options name, may be null or {@link NamedOptions#DEFAULT_NAME}
     * @param options the instance to configure
     */
    void configure(String name, T options);

    /**
     * Configure the default options instance.
     *
     * @param options the instance to configure
     */
    default void configure(T options) {
        configure(NamedOptions.DEFAULT_NAME, options);
    }
}
