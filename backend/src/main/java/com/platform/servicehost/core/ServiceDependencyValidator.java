package com.platform.servicehost.core;

import com.platform.servicehost.model.ServiceRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks dependency sets before they are assigned and computes start orders.
 */
@Component
public class ServiceDependencyValidator {
    
    /**
     * @param serviceId    the service whose dependencies are being set
     * @param dependencies the proposed dependency ids
     * @param existing     every known record, possibly including {@code serviceId} itself
     * @return the violation, if any
     */
    public Optional<String> validate(String serviceId, Set<String> dependencies, Collection<ServiceRecord> existing) {
        if (dependencies == null || dependencies.isEmpty()) {
            return Optional.empty();
        }
        
        Map<String, Set<String>> graph = graphOf(existing);
        for (String dependency : dependencies) {
            if (dependency == null || dependency.isBlank()) {
                return Optional.of("Dependency id is empty");
            }
            if (dependency.equals(serviceId)) {
                return Optional.of("A service cannot depend on itself");
            }
            if (!graph.containsKey(dependency)) {
                return Optional.of("Dependency does not exist: " + dependency);
            }
        }
        
        graph.put(serviceId, new LinkedHashSet<>(dependencies));
        List<String> cycle = findCycle(serviceId, graph, new HashSet<>(), new ArrayList<>());
        if (!cycle.isEmpty()) {
            return Optional.of("Circular dependency: " + String.join(" -> ", cycle));
        }
        return Optional.empty();
    }
    
    /**
     * Dependencies first, {@code serviceId} last. Unknown ids are skipped.
     */
    public List<String> startOrder(String serviceId, Collection<ServiceRecord> existing) {
        Map<String, Set<String>> graph = graphOf(existing);
        List<String> order = new ArrayList<>();
        visitForOrder(serviceId, graph, new HashSet<>(), order);
        return order;
    }
    
    /**
     * Ids of services that list {@code serviceId} as a dependency.
     */
    public List<String> dependents(String serviceId, Collection<ServiceRecord> existing) {
        return existing.stream()
            .filter(r -> r.getDependencies().contains(serviceId))
            .map(ServiceRecord::getId)
            .toList();
    }
    
    private List<String> findCycle(String node, Map<String, Set<String>> graph,
                                   Set<String> done, List<String> path) {
        int index = path.indexOf(node);
        if (index >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
            cycle.add(node);
            return cycle;
        }
        if (done.contains(node)) {
            return List.of();
        }
        path.add(node);
        for (String next : graph.getOrDefault(node, Set.of())) {
            List<String> cycle = findCycle(next, graph, done, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        done.add(node);
        return List.of();
    }
    
    private void visitForOrder(String node, Map<String, Set<String>> graph, Set<String> visited, List<String> order) {
        if (!graph.containsKey(node) || !visited.add(node)) {
            return;
        }
        for (String dependency : graph.get(node)) {
            visitForOrder(dependency, graph, visited, order);
        }
        order.add(node);
    }
    
    private static Map<String, Set<String>> graphOf(Collection<ServiceRecord> records) {
        Map<String, Set<String>> graph = new HashMap<>();
        for (ServiceRecord record : records) {
            graph.put(record.getId(), new LinkedHashSet<>(record.getDependencies()));
        }
        return graph;
    }
}
