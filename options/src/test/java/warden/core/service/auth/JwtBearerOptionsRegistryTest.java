package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.config.InMemoryConfigurationSection;
import warden.core.cache.CaffeineLocalCache;
import warden.core.model.auth.JwtBearerOptions;
import warden.core.model.common.ConfigurationFormatException;
import warden.core.options.ConfigureNamedOptions;
import warden.core.options.NamedOptions;
import warden.core.options.PostConfigureOptions;
import warden.core.port.out.SchemeConfigurationProvider;
import warden.mock.FakeDataProtectionProvider;

@DisplayName("JwtBearerOptionsRegistry")
class JwtBearerOptionsRegistryTest {

    private Map<String, String> values;
    private JwtBearerOptionsRegistry registry;

    @BeforeEach
    void setUp() {
        values = new HashMap<>();
        final SchemeConfigurationProvider configurationProvider = scheme -> {
            final var section = InMemoryConfigurationSection.of(values).getSection(scheme);
            return section.exists() ? Optional.of(section) : Optional.empty();
        };
        final var configureOptions = new JwtBearerConfigureOptions(
                configurationProvider, new FakeDataProtectionProvider(), new ObjectMapper().findAndRegisterModules());

        registry = new JwtBearerOptionsRegistry(
                List.of(configureOptions), List.of(new JwtBearerPostConfigureOptions()), new CaffeineLocalCache<>(100));
    }

    @Nested
    @DisplayName("get()")
    class Get {

        @Test
        @DisplayName("should build configured and post-configured options")
        void shouldBuildOptions() {
            values.put("Bearer.Authority", "https://login.example.com");
            values.put("Bearer.ValidIssuers[0]", "https://login.example.com");

            final var options = registry.get("Bearer");

            assertEquals("https://login.example.com", options.getAuthority());
            assertEquals("https://login.example.com/.well-known/openid-configuration", options.getMetadataAddress());
            assertTrue(options.getTokenValidationParameters().validateIssuer());
            assertNotNull(options.getBearerTokenProtector());
        }

        @Test
        @DisplayName("should cache options per name")
        void shouldCachePerName() {
            final var first = registry.get("Bearer");
            final var second = registry.get("Bearer");
            final var other = registry.get("Other");

            assertSame(first, second);
            assertNotSame(first, other);
        }

        @Test
        @DisplayName("should serve a snapshot until invalidated")
        void shouldServeSnapshotUntilInvalidated() {
            values.put("Bearer.Challenge", "First");
            assertEquals("First", registry.get("Bearer").getChallenge());

            values.put("Bearer.Challenge", "Second");
            assertEquals("First", registry.get("Bearer").getChallenge());

            registry.invalidate("Bearer");
            assertEquals("Second", registry.get("Bearer").getChallenge());
        }

        @Test
        @DisplayName("should rebuild every scheme after clear")
        void shouldRebuildAfterClear() {
            final var bearer = registry.get("Bearer");
            final var other = registry.get("Other");

            registry.clear();

            assertNotSame(bearer, registry.get("Bearer"));
            assertNotSame(other, registry.get("Other"));
        }

        @Test
        @DisplayName("should return unconfigured options for the default name")
        void shouldReturnDefaultOptions() {
            final var options = registry.getDefault();

            assertNull(options.getBearerTokenProtector());
            assertSame(options, registry.get(null));
            assertSame(options, registry.get(NamedOptions.DEFAULT_NAME));
        }

        @Test
        @DisplayName("should propagate build failures and cache nothing")
        void shouldPropagateFailures() {
            values.put("Bearer.BackchannelTimeout", "notaduration");

            assertThrows(ConfigurationFormatException.class, () -> registry.get("Bearer"));

            values.put("Bearer.BackchannelTimeout", "00:00:10");
            assertEquals(10, registry.get("Bearer").getBackchannelTimeout().toSeconds());
        }

        @Test
        @DisplayName("should propagate post-configure failures")
        void shouldPropagatePostConfigureFailures() {
            values.put("Bearer.Authority", "http://insecure.example.com");

            assertThrows(IllegalStateException.class, () -> registry.get("Bearer"));
        }
    }

    @Nested
    @DisplayName("tryAdd()")
    class TryAdd {

        @Test
        @DisplayName("should register options for an unused name")
        void shouldRegisterOptions() {
            final var options = new JwtBearerOptions();

            assertTrue(registry.tryAdd("Manual", options));
            assertSame(options, registry.get("Manual"));
        }

        @Test
        @DisplayName("should not replace cached options")
        void shouldNotReplaceCachedOptions() {
            final var cached = registry.get("Bearer");

            assertFalse(registry.tryAdd("Bearer", new JwtBearerOptions()));
            assertSame(cached, registry.get("Bearer"));
        }
    }

    @Nested
    @DisplayName("build pipeline")
    class BuildPipeline {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("should run configurers before post-configurers, in order")
        void shouldRunInOrder() {
            final ConfigureNamedOptions<JwtBearerOptions> first = mock(ConfigureNamedOptions.class);
            final ConfigureNamedOptions<JwtBearerOptions> second = mock(ConfigureNamedOptions.class);
            final PostConfigureOptions<JwtBearerOptions> post = mock(PostConfigureOptions.class);
            final var pipeline =
                    new JwtBearerOptionsRegistry(List.of(first, second), List.of(post), new CaffeineLocalCache<>(10));

            pipeline.get("Bearer");

            final var order = inOrder(first, second, post);
            order.verify(first).configure(eq("Bearer"), any(JwtBearerOptions.class));
            order.verify(second).configure(eq("Bearer"), any(JwtBearerOptions.class));
            order.verify(post).postConfigure(eq("Bearer"), any(JwtBearerOptions.class));
        }

        @Test
        @DisplayName("should build once for concurrent requests of the same name")
        void shouldBuildOnceForConcurrentRequests() throws Exception {
            final var builds = new AtomicInteger();
            final var release = new CountDownLatch(1);
            final ConfigureNamedOptions<JwtBearerOptions> slow = (name, options) -> {
                builds.incrementAndGet();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            final var pipeline = new JwtBearerOptionsRegistry(List.of(slow), List.of(), new CaffeineLocalCache<>(10));

            final var executor = Executors.newFixedThreadPool(4);
            try {
                final var tasks = new ArrayList<Callable<JwtBearerOptions>>();
                for (int i = 0; i < 4; i++) {
                    tasks.add(() -> pipeline.get("Bearer"));
                }
                final var futures = tasks.stream().map(executor::submit).toList();
                release.countDown();

                final var first = futures.get(0).get(5, TimeUnit.SECONDS);
                for (var future : futures) {
                    assertSame(first, future.get(5, TimeUnit.SECONDS));
                }
                assertEquals(1, builds.get());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("should create uncached instances on demand")
        void shouldCreateUncachedInstances() {
            final ConfigureNamedOptions<JwtBearerOptions> configurer = mock(ConfigureNamedOptions.class);
            final var pipeline = new JwtBearerOptionsRegistry(List.of(configurer), List.of(), new CaffeineLocalCache<>(10));

            assertNotSame(pipeline.create("Bearer"), pipeline.create("Bearer"));
            verify(configurer, times(2)).configure(eq("Bearer"), any(JwtBearerOptions.class));
        }
    }
}
