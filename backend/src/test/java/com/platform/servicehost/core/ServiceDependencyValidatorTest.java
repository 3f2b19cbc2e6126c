package com.platform.servicehost.core;

import com.platform.servicehost.model.ServiceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceDependencyValidatorTest {

    private final ServiceDependencyValidator validator = new ServiceDependencyValidator();

    private static ServiceRecord service(String id, String... dependencies) {
        return ServiceRecord.builder()
            .id(id)
            .displayName("Service " + id)
            .executablePath("C:\\apps\\" + id + ".exe")
            .dependencies(Set.of(dependencies))
            .build();
    }

    @Test
    void validate_noDependencies_shouldPass() {
        assertTrue(validator.validate("a", Set.of(), List.of()).isEmpty());
        assertTrue(validator.validate("a", null, List.of()).isEmpty());
    }

    @Test
    void validate_existingDependency_shouldPass() {
        assertTrue(validator.validate("web", Set.of("db"), List.of(service("db"))).isEmpty());
    }

    @Test
    void validate_unknownDependency_shouldFail() {
        Optional<String> error = validator.validate("web", Set.of("cache"), List.of(service("db")));

        assertTrue(error.orElseThrow().contains("cache"));
    }

    @Test
    void validate_selfDependency_shouldFail() {
        Optional<String> error = validator.validate("web", Set.of("web"), List.of(service("web")));

        assertEquals("A service cannot depend on itself", error.orElseThrow());
    }

    @Test
    void validate_cycleThroughExistingServices_shouldNameThePath() {
        List<ServiceRecord> existing = List.of(service("a", "b"), service("b", "c"), service("c"));

        Optional<String> error = validator.validate("c", Set.of("a"), existing);

        assertTrue(error.orElseThrow().startsWith("Circular dependency: "));
        assertTrue(error.get().contains("c -> a -> b -> c"));
    }

    @Test
    void startOrder_shouldPlaceDependenciesFirst() {
        List<ServiceRecord> existing = List.of(service("web", "api"), service("api", "db"), service("db"));

        assertEquals(List.of("db", "api", "web"), validator.startOrder("web", existing));
    }

    @Test
    void startOrder_sharedDependency_shouldAppearOnce() {
        List<ServiceRecord> existing = List.of(
            service("web", "api", "db"), service("api", "db"), service("db"));

        List<String> order = validator.startOrder("web", existing);

        assertEquals(3, order.size());
        assertEquals("db", order.get(0));
        assertEquals("web", order.get(2));
    }

    @Test
    void dependents_shouldListServicesThatNeedTheGivenOne() {
        List<ServiceRecord> existing = List.of(service("web", "db"), service("report", "db"), service("db"));

        assertEquals(List.of("web", "report"), validator.dependents("db", existing));
        assertTrue(validator.dependents("web", existing).isEmpty());
    }
}
