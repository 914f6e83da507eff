package com.example.jobqueue.service.function;

import com.example.jobqueue.exception.UnknownJobFunctionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for job functions.
 * <p>
 * Discovers all JobFunction beans at startup and accepts programmatic registration
 * afterwards. Provides lookup by function name.
 */
@Slf4j
@Component
public class JobFunctionRegistry {

    private final Map<String, JobFunction> functions = new ConcurrentHashMap<>();
    private final List<JobFunction> functionBeans;

    public JobFunctionRegistry(List<JobFunction> functionBeans) {
        this.functionBeans = functionBeans;
    }

    @PostConstruct
    public void initialize() {
        functionBeans.forEach(this::register);
        log.info("Registered {} job functions: {}", functions.size(), getRegisteredNames());
    }

    /**
     * Register a function under its own name, replacing any previous registration
     */
    public void register(JobFunction function) {
        var previous = functions.put(function.getName(), function);
        if (previous != null && previous != function) {
            log.warn("Duplicate job function {}: {} will override {}", function.getName(),
                    function.getClass().getSimpleName(), previous.getClass().getSimpleName());
        } else {
            log.debug("Registered job function {}: {}", function.getName(), function.getClass().getSimpleName());
        }
    }

    public Optional<JobFunction> getFunction(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
    }

    /**
     * Get a function by name, throwing if not found
     *
     * @throws UnknownJobFunctionException if nothing is registered under the name
     */
    public JobFunction getFunctionOrThrow(String name) {
        return getFunction(name).orElseThrow(() -> new UnknownJobFunctionException(name));
    }

    public boolean hasFunction(String name) {
        return name != null && functions.containsKey(name);
    }

    public Set<String> getRegisteredNames() {
        return new TreeSet<>(functions.keySet());
    }
}
