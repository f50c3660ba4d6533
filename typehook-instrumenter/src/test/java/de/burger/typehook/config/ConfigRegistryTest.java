package de.burger.typehook.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ConfigRegistryTest {

    @Test
    void idsAreSequentialPerInstance() {
        ConfigRegistry registry = new ConfigRegistry();
        InstrumentationConfig first = InstrumentationConfig.builder().build();
        InstrumentationConfig second = InstrumentationConfig.builder().build();

        assertThat(registry.register(first)).isZero();
        assertThat(registry.register(second)).isEqualTo(1);
        assertThat(registry.register(first)).isZero();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void lookupResolvesIdsBack() {
        ConfigRegistry registry = new ConfigRegistry();
        InstrumentationConfig config = InstrumentationConfig.builder().label("strict").build();
        int id = registry.register(config);

        assertThat(registry.lookup(id)).containsSame(config);
        assertThat(registry.lookup(id + 1)).isEmpty();
        assertThat(registry.lookup(-1)).isEmpty();
    }

    @Test
    void registeredConfigsStayResolvableAfterCallersDropThem() {
        ConfigRegistry registry = new ConfigRegistry();
        int id = registry.register(InstrumentationConfig.builder().label("transient").build());

        System.gc();

        assertThat(registry.lookup(id)).hasValueSatisfying(c -> assertThat(c.label()).isEqualTo("transient"));
    }

    @Test
    void concurrentRegistrationHandsOutOneIdPerInstance() throws Exception {
        ConfigRegistry registry = new ConfigRegistry();
        List<InstrumentationConfig> configs = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            configs.add(InstrumentationConfig.builder().label("c" + i).build());
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int round = 0; round < 10; round++) {
                for (InstrumentationConfig config : configs) {
                    tasks.add(() -> registry.register(config));
                }
            }
            List<Future<Integer>> results = pool.invokeAll(tasks);
            Set<Integer> ids = results.stream().map(ConfigRegistryTest::join).collect(Collectors.toSet());

            assertThat(ids).hasSize(16);
            assertThat(registry.size()).isEqualTo(16);
            for (InstrumentationConfig config : configs) {
                assertThat(registry.lookup(registry.register(config))).containsSame(config);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static int join(Future<Integer> future) {
        try {
            return future.get();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
