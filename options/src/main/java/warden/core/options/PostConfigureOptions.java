package warden.core.options;

/**
 * Finalizes a named options instance after every {@link ConfigureNamedOptions}
 * has run.
 *
 * @param <T> the options type
 */
public interface PostConfigureOptions<T> {

    /**
     * Finalize the options instance registered under {@code name}.
     *
     * @param name    the options name
     * @param options the configured instance
     */
    void postConfigure(String name, T options);
}
